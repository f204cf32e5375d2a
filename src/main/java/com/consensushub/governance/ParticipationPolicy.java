package com.consensushub.governance;

import java.util.List;
import java.util.Map;

/**
 * Policy: requires a minimum number of participating nodes.
 */
public class ParticipationPolicy implements GovernancePolicy {

    private final int minParticipants;

    public ParticipationPolicy(int minParticipants) {
        this.minParticipants = minParticipants;
    }

    @Override
    public String policyId() {
        return "min-participation";
    }

    @Override
    public String policyVersion() {
        return "v1";
    }

    @Override
    public PolicyResult evaluate(String actionKey, Map<String, Object> context) {
        if (!(context.get("participatingNodes") instanceof List<?> nodes)) {
            return new PolicyResult.Reject("MISSING_PARTICIPANTS", "participatingNodes is required");
        }

        if (nodes.size() < minParticipants) {
            return new PolicyResult.Reject("INSUFFICIENT_PARTICIPATION",
                nodes.size() + " participating nodes, at least " + minParticipants + " required");
        }

        return new PolicyResult.Pass();
    }
}
