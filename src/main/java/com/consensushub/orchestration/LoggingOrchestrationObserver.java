package com.consensushub.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class LoggingOrchestrationObserver implements OrchestrationObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingOrchestrationObserver.class);

    @Override
    public void onStageEntered(String consensusId, OrchestrationStage stage) {
        log.debug("Round {} entered stage {}", consensusId, stage);
    }

    @Override
    public void onRoundCompleted(OrchestrationResult result) {
        log.info("Round {} completed: status={}, agreementRatio={}, conflictLevel={}, governanceApproved={}",
            result.consensusId(),
            result.status().getValue(),
            String.format(Locale.ROOT, "%.3f", result.agreementRatio()),
            String.format(Locale.ROOT, "%.3f", result.conflictLevel()),
            result.governanceApproved());
    }

    @Override
    public void onRoundFailed(String consensusId, OrchestrationStage stage, RuntimeException error) {
        log.warn("Round {} aborted in stage {}: {}", consensusId, stage, error.getMessage());
    }
}
