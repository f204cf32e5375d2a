package com.consensushub.governance;

import java.util.Locale;
import java.util.Map;

/**
 * Policy: refuses rounds whose conflict level is above a ceiling.
 */
public class ConflictCeilingPolicy implements GovernancePolicy {

    private final double maxConflictLevel;

    public ConflictCeilingPolicy(double maxConflictLevel) {
        this.maxConflictLevel = maxConflictLevel;
    }

    @Override
    public String policyId() {
        return "conflict-ceiling";
    }

    @Override
    public String policyVersion() {
        return "v1";
    }

    @Override
    public PolicyResult evaluate(String actionKey, Map<String, Object> context) {
        if (!(context.get("conflictLevel") instanceof Number conflict)) {
            return new PolicyResult.Reject("MISSING_CONFLICT_LEVEL", "conflictLevel is required");
        }

        if (conflict.doubleValue() > maxConflictLevel) {
            return new PolicyResult.Reject("CONFLICT_CEILING_EXCEEDED",
                String.format(Locale.ROOT, "conflict level %.2f exceeds %.2f",
                    conflict.doubleValue(), maxConflictLevel));
        }

        return new PolicyResult.Pass();
    }
}
