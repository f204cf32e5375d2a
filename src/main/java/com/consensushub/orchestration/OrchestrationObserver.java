package com.consensushub.orchestration;

/**
 * Side-effect port notified as a round moves through its stages. Observer
 * failures are logged and never abort a round.
 */
public interface OrchestrationObserver {

    default void onStageEntered(String consensusId, OrchestrationStage stage) {
    }

    default void onRoundCompleted(OrchestrationResult result) {
    }

    default void onRoundFailed(String consensusId, OrchestrationStage stage, RuntimeException error) {
    }
}
