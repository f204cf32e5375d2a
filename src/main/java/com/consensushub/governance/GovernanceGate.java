package com.consensushub.governance;

import java.util.Map;

/**
 * External policy check consulted when a round needs governance review.
 * Implementations may block on I/O; timeouts and retries are theirs.
 */
public interface GovernanceGate {

    /**
     * @param initiator node that started the round
     * @param actionKey e.g. "orchestrate_scale-up"
     * @param context round signals: consensusId, agreementRatio, conflictLevel, participatingNodes
     */
    GovernanceVerdict submitDecision(String initiator, String actionKey, Map<String, Object> context);
}
