package com.consensushub.orchestration;

/**
 * States of a round, in order. A failure in any state aborts the round.
 */
public enum OrchestrationStage {
    VALIDATING,
    GRAPH_BUILDING,
    ANALYZING,
    RESOLVING,
    GOVERNANCE_CHECK,
    PERSISTED
}
