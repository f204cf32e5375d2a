package com.consensushub.api;

import com.consensushub.consensus.DecisionChecksum;
import com.consensushub.contract.OrchestrationRequest;
import com.consensushub.contract.ValidationException;
import com.consensushub.orchestration.ConsensusOrchestrator;
import com.consensushub.orchestration.OrchestrationResult;
import com.consensushub.store.ConsensusRecord;
import com.consensushub.store.ConsensusStatistics;
import com.consensushub.store.StatusUpdate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Round entry point.
 *
 * POST  /v1/consensus/orchestrations   run a round
 * GET   /v1/consensus/{consensusId}    stored round
 * GET   /v1/consensus/stats            aggregate statistics
 * GET   /v1/consensus/recent           newest rounds first
 * PATCH /v1/consensus/{consensusId}    record execution / broadcast outcome
 * POST  /v1/consensus/verify           check a received decision against its checksum
 *
 * Callers are authenticated upstream; this controller trusts its input.
 */
@RestController
@RequestMapping("/v1/consensus")
public class ConsensusController {

    private final ConsensusOrchestrator orchestrator;

    public ConsensusController(ConsensusOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/orchestrations")
    public OrchestrationResult orchestrate(@RequestBody OrchestrationRequest request) {
        return orchestrator.orchestrate(request);
    }

    @GetMapping("/stats")
    public ConsensusStatistics statistics() {
        return orchestrator.getStatistics();
    }

    @GetMapping("/recent")
    public List<ConsensusRecord> recent(@RequestParam(defaultValue = "10") int limit) {
        return orchestrator.listRecent(limit);
    }

    @GetMapping("/{consensusId}")
    public ConsensusRecord getConsensus(@PathVariable String consensusId) {
        return orchestrator.getConsensus(consensusId)
            .orElseThrow(() -> new ConsensusNotFoundException(consensusId));
    }

    @PatchMapping("/{consensusId}")
    public ConsensusRecord updateStatus(@PathVariable String consensusId, @RequestBody StatusUpdate update) {
        return orchestrator.updateConsensusStatus(consensusId, update);
    }

    @PostMapping("/verify")
    public Map<String, Object> verify(@RequestBody ChecksumVerificationRequest request) {
        if (request.finalDecision() == null) {
            throw new ValidationException("final_decision is required");
        }
        if (request.checksum() == null || request.checksum().isBlank()) {
            throw new ValidationException("checksum is required");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("consensus_id", request.consensusId());
        body.put("valid", DecisionChecksum.verify(request.finalDecision(), request.checksum()));
        body.put("expected_checksum", DecisionChecksum.of(request.finalDecision()));
        return body;
    }
}
