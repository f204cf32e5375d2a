package com.consensushub.api;

import com.consensushub.consensus.DecisionChecksum;
import com.consensushub.consensus.Vote;
import com.consensushub.consensus.VotingResult;
import com.consensushub.contract.ConsensusMethod;
import com.consensushub.contract.DecisionStatus;
import com.consensushub.contract.OrchestrationRequest;
import com.consensushub.contract.ValidationException;
import com.consensushub.governance.GovernanceUnavailableException;
import com.consensushub.orchestration.ConsensusOrchestrator;
import com.consensushub.orchestration.OrchestrationResult;
import com.consensushub.store.ConsensusStatistics;
import com.consensushub.store.IllegalTransitionException;
import com.consensushub.store.StatusUpdate;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ConsensusController.class)
class ConsensusControllerTest {

    private static final String ROUND = """
        {
          "initiator_node": "hub",
          "decision_type": "scale-up",
          "consensus_method": "majority",
          "requires_governance": true,
          "node_decisions": [
            {"node_id": "n1", "decision_type": "scale-up", "payload": {"replicas": 5},
             "confidence": 0.9, "expected_impact": 0.8, "dependencies": ["n2"]},
            {"node_id": "n2", "decision_type": "scale-up", "payload": {"replicas": 7},
             "confidence": 0.85, "expected_impact": 0.7}
          ]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ConsensusOrchestrator orchestrator;

    @Test
    void orchestrate_readsSnakeCaseAndReturnsResult() throws Exception {
        when(orchestrator.orchestrate(any())).thenReturn(sampleResult());

        mockMvc.perform(post("/v1/consensus/orchestrations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ROUND))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.consensus_id").value("consensus-1"))
            .andExpect(jsonPath("$.status").value("approved"))
            .andExpect(jsonPath("$.consensus_method").value("majority"))
            .andExpect(jsonPath("$.voting_results.n1.vote").value("approve"))
            .andExpect(jsonPath("$.final_decision.payload.replicas").value(6))
            .andExpect(jsonPath("$.governance_approved").value(true));

        verify(orchestrator).orchestrate(argThat((OrchestrationRequest request) ->
            request.consensusMethod() == ConsensusMethod.MAJORITY
                && request.governanceRequested()
                && request.nodeDecisions().size() == 2
                && request.nodeDecisions().get(0).dependsOn("n2")
                && request.nodeDecisions().get(1).expectedImpact() == 0.7));
    }

    @Test
    void orchestrate_validationErrorNamesNode() throws Exception {
        when(orchestrator.orchestrate(any()))
            .thenThrow(new ValidationException("Invalid confidence for node n2: must be between 0 and 1", "n2"));

        mockMvc.perform(post("/v1/consensus/orchestrations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ROUND))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"))
            .andExpect(jsonPath("$.node_id").value("n2"));
    }

    @Test
    void orchestrate_unknownMethodIsBadRequest() throws Exception {
        mockMvc.perform(post("/v1/consensus/orchestrations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ROUND.replace("\"majority\"", "\"plurality\"")))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
    }

    @Test
    void orchestrate_governanceOutageIs503() throws Exception {
        when(orchestrator.orchestrate(any()))
            .thenThrow(new GovernanceUnavailableException("Governance gate failed", null));

        mockMvc.perform(post("/v1/consensus/orchestrations")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ROUND))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error_code").value("GOVERNANCE_UNAVAILABLE"));
    }

    @Test
    void getConsensus_unknownIdIs404() throws Exception {
        when(orchestrator.getConsensus("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/consensus/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("CONSENSUS_NOT_FOUND"));
    }

    @Test
    void statistics_areSnakeCase() throws Exception {
        when(orchestrator.getStatistics()).thenReturn(new ConsensusStatistics(3, 1, 1, 0, 1, 0.8, 0.2, 2));

        mockMvc.perform(get("/v1/consensus/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(3))
            .andExpect(jsonPath("$.review_required").value(1))
            .andExpect(jsonPath("$.governance_approved_count").value(2));
    }

    @Test
    void recent_defaultsToTen() throws Exception {
        when(orchestrator.listRecent(10)).thenReturn(List.of());

        mockMvc.perform(get("/v1/consensus/recent"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());

        verify(orchestrator).listRecent(10);
    }

    @Test
    void patch_illegalTransitionIs409() throws Exception {
        when(orchestrator.updateConsensusStatus(eq("consensus-1"), any(StatusUpdate.class)))
            .thenThrow(new IllegalTransitionException(
                "Illegal status transition for consensus-1: review_required -> executed"));

        mockMvc.perform(patch("/v1/consensus/consensus-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"executed\", \"actual_impact\": 0.4}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value("ILLEGAL_TRANSITION"));
    }

    @Test
    void patch_unrelatedIllegalStateIsInternalError() throws Exception {
        when(orchestrator.updateConsensusStatus(eq("consensus-1"), any(StatusUpdate.class)))
            .thenThrow(new IllegalStateException("SHA-256 is not available"));

        mockMvc.perform(patch("/v1/consensus/consensus-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"status\": \"executed\"}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error_code").value("INTERNAL_ERROR"));
    }

    @Test
    void verify_comparesChecksum() throws Exception {
        Map<String, Object> decision = new LinkedHashMap<>();
        decision.put("decision_type", "scale-up");
        decision.put("payload", Map.of("replicas", 6));
        String checksum = DecisionChecksum.of(decision);

        mockMvc.perform(post("/v1/consensus/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"consensus_id\": \"consensus-1\", "
                    + "\"final_decision\": {\"decision_type\": \"scale-up\", \"payload\": {\"replicas\": 6}}, "
                    + "\"checksum\": \"" + checksum + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true))
            .andExpect(jsonPath("$.expected_checksum").value(checksum));

        mockMvc.perform(post("/v1/consensus/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"final_decision\": {\"decision_type\": \"scale-down\"}, "
                    + "\"checksum\": \"" + checksum + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(false));
    }

    @Test
    void verify_requiresChecksum() throws Exception {
        mockMvc.perform(post("/v1/consensus/verify")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"final_decision\": {\"decision_type\": \"scale-up\"}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"));
    }

    private static OrchestrationResult sampleResult() {
        Map<String, Object> decision = new LinkedHashMap<>();
        decision.put("decision_type", "scale-up");
        decision.put("payload", Map.of("replicas", 6L));
        return new OrchestrationResult("consensus-1", DecisionStatus.APPROVED, true, ConsensusMethod.MAJORITY,
            1.0, decision, 0.95, DecisionChecksum.of(decision),
            Map.of("n1", new VotingResult(Vote.APPROVE, 0.648), "n2", new VotingResult(Vote.APPROVE, 0.5)),
            List.of("n1", "n2"), 0.0, 1.0, true, null, List.of(), Instant.now());
    }
}
