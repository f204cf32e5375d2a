package com.consensushub.orchestration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "consensus-hub.orchestration")
public class OrchestrationProperties {

    private int minNodes = 2;
    private double autoApproveThreshold = 0.8;
    private double governanceConflictThreshold = 0.5;
    private double autoApproveConflictCeiling = 0.3;

    public int getMinNodes() {
        return minNodes;
    }

    public void setMinNodes(int minNodes) {
        this.minNodes = minNodes;
    }

    public double getAutoApproveThreshold() {
        return autoApproveThreshold;
    }

    public void setAutoApproveThreshold(double autoApproveThreshold) {
        this.autoApproveThreshold = autoApproveThreshold;
    }

    public double getGovernanceConflictThreshold() {
        return governanceConflictThreshold;
    }

    public void setGovernanceConflictThreshold(double governanceConflictThreshold) {
        this.governanceConflictThreshold = governanceConflictThreshold;
    }

    public double getAutoApproveConflictCeiling() {
        return autoApproveConflictCeiling;
    }

    public void setAutoApproveConflictCeiling(double autoApproveConflictCeiling) {
        this.autoApproveConflictCeiling = autoApproveConflictCeiling;
    }
}
