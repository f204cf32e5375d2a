package com.consensushub.governance;

import java.util.Map;

/**
 * A single governance rule evaluated against a round's signals.
 * Policies are deterministic: no randomness, no external calls.
 */
public interface GovernancePolicy {

    /** Unique policy identifier, e.g. "conflict-ceiling". */
    String policyId();

    /** Policy version, e.g. "v1". */
    String policyVersion();

    /**
     * @param actionKey the action the initiator asks to perform
     * @param context the round signals passed to the gate
     * @return PASS, or a rejection with a reason code
     */
    PolicyResult evaluate(String actionKey, Map<String, Object> context);

    sealed interface PolicyResult {
        record Pass() implements PolicyResult {}
        record Reject(String reasonCode, String detail) implements PolicyResult {}
    }
}
