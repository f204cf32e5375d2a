package com.consensushub.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input of one consensus round.
 *
 * @param consensusMethod optional, weighted-vote when absent
 * @param requiresGovernance optional, forces the governance gate when true
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrchestrationRequest(
    String initiatorNode,
    String decisionType,
    List<NodeDecision> nodeDecisions,
    ConsensusMethod consensusMethod,
    Boolean requiresGovernance
) {

    public OrchestrationRequest {
        nodeDecisions = nodeDecisions == null ? null : Collections.unmodifiableList(new ArrayList<>(nodeDecisions));
    }

    public ConsensusMethod effectiveMethod() {
        return ConsensusMethod.orDefault(consensusMethod);
    }

    public boolean governanceRequested() {
        return Boolean.TRUE.equals(requiresGovernance);
    }
}
