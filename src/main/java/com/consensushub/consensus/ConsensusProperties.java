package com.consensushub.consensus;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Resolver thresholds and weighting toggles.
 *
 * Both weighting toggles are on by default, which makes a vote weigh
 * {@code confidence^2 * expectedImpact}: confidence counts once as the base
 * weight and once more as the weight-by-confidence multiplier.
 */
@Component
@ConfigurationProperties(prefix = "consensus-hub.resolver")
public class ConsensusProperties {

    private double approvalThreshold = 0.7;
    private double quorumPercentage = 0.6;
    private boolean weightByConfidence = true;
    private boolean weightByImpact = true;
    private double conflictCeiling = 0.3;

    public double getApprovalThreshold() {
        return approvalThreshold;
    }

    public void setApprovalThreshold(double approvalThreshold) {
        this.approvalThreshold = approvalThreshold;
    }

    public double getQuorumPercentage() {
        return quorumPercentage;
    }

    public void setQuorumPercentage(double quorumPercentage) {
        this.quorumPercentage = quorumPercentage;
    }

    public boolean isWeightByConfidence() {
        return weightByConfidence;
    }

    public void setWeightByConfidence(boolean weightByConfidence) {
        this.weightByConfidence = weightByConfidence;
    }

    public boolean isWeightByImpact() {
        return weightByImpact;
    }

    public void setWeightByImpact(boolean weightByImpact) {
        this.weightByImpact = weightByImpact;
    }

    public double getConflictCeiling() {
        return conflictCeiling;
    }

    public void setConflictCeiling(double conflictCeiling) {
        this.conflictCeiling = conflictCeiling;
    }
}
