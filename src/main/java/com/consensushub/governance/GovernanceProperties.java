package com.consensushub.governance;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "consensus-hub.governance")
public class GovernanceProperties {

    private double maxConflictLevel = 0.75;
    private int minParticipants = 2;

    public double getMaxConflictLevel() {
        return maxConflictLevel;
    }

    public void setMaxConflictLevel(double maxConflictLevel) {
        this.maxConflictLevel = maxConflictLevel;
    }

    public int getMinParticipants() {
        return minParticipants;
    }

    public void setMinParticipants(int minParticipants) {
        this.minParticipants = minParticipants;
    }
}
