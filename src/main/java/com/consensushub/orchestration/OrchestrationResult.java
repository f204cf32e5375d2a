package com.consensushub.orchestration;

import com.consensushub.consensus.VotingResult;
import com.consensushub.contract.ConsensusMethod;
import com.consensushub.contract.DecisionStatus;
import com.consensushub.contract.Payloads;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of one round, after governance reconciliation. Created only
 * by {@link ConsensusOrchestrator}; its numbers are never changed afterwards.
 *
 * @param status the governance-adjusted status at the end of the round
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrchestrationResult(
    String consensusId,
    DecisionStatus status,
    boolean consensusReached,
    ConsensusMethod consensusMethod,
    double agreementRatio,
    Map<String, Object> finalDecision,
    double finalConfidence,
    String checksum,
    Map<String, VotingResult> votingResults,
    List<String> participatingNodes,
    double conflictLevel,
    double coherenceScore,
    boolean governanceApproved,
    String reviewReason,
    List<String> recommendations,
    Instant createdAt
) {

    public OrchestrationResult {
        finalDecision = Payloads.freeze(finalDecision);
        votingResults = Collections.unmodifiableMap(new LinkedHashMap<>(votingResults));
        participatingNodes = List.copyOf(participatingNodes);
        recommendations = List.copyOf(recommendations);
    }
}
