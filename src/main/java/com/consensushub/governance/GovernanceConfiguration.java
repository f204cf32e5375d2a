package com.consensushub.governance;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class GovernanceConfiguration {

    /**
     * Default in-process gate with two policies:
     * 1. Participation floor
     * 2. Conflict ceiling
     */
    @Bean
    public GovernanceGate governanceGate(GovernanceProperties properties) {
        return new PolicyGovernanceGate(List.of(
            new ParticipationPolicy(properties.getMinParticipants()),
            new ConflictCeilingPolicy(properties.getMaxConflictLevel())
        ));
    }
}
