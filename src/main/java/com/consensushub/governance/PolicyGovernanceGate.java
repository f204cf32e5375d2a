package com.consensushub.governance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * In-process governance gate backed by an ordered list of policies.
 * Policies run in order; the first rejection wins.
 */
public class PolicyGovernanceGate implements GovernanceGate {

    private static final Logger log = LoggerFactory.getLogger(PolicyGovernanceGate.class);

    private final List<GovernancePolicy> policies;

    public PolicyGovernanceGate(List<GovernancePolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    @Override
    public GovernanceVerdict submitDecision(String initiator, String actionKey, Map<String, Object> context) {
        for (GovernancePolicy policy : policies) {
            GovernancePolicy.PolicyResult result = policy.evaluate(actionKey, context);
            if (result instanceof GovernancePolicy.PolicyResult.Reject reject) {
                log.info("Action {} from {} rejected by policy {}/{}: {}",
                    actionKey, initiator, policy.policyId(), policy.policyVersion(), reject.reasonCode());
                return GovernanceVerdict.rejected(reject.reasonCode() + ": " + reject.detail());
            }
        }

        log.info("Action {} from {} approved by all {} policies", actionKey, initiator, policies.size());
        return GovernanceVerdict.approved();
    }

    public List<GovernancePolicy> getPolicies() {
        return policies;
    }
}
