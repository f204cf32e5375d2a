package com.consensushub.consensus;

import com.consensushub.contract.ConsensusMethod;
import com.consensushub.contract.DecisionStatus;
import com.consensushub.contract.Payloads;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of the resolver, before governance reconciliation.
 *
 * @param checksum SHA-256 hex of the serialized final decision
 * @param votingResults per node, in input order
 * @param status APPROVED or REVIEW_REQUIRED
 * @param reviewReason set when status is REVIEW_REQUIRED
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConsensusResult(
    boolean consensusReached,
    double agreementRatio,
    ConsensusMethod consensusMethod,
    Map<String, Object> finalDecision,
    double finalConfidence,
    String checksum,
    Map<String, VotingResult> votingResults,
    DecisionStatus status,
    String reviewReason,
    Instant resolvedAt
) {

    public ConsensusResult {
        finalDecision = Payloads.freeze(finalDecision);
        votingResults = Collections.unmodifiableMap(new LinkedHashMap<>(votingResults));
    }
}
