package com.consensushub.consensus;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ConsensusConfiguration {

    @Bean
    public ConsensusResolver consensusResolver(ConsensusProperties properties) {
        return new ConsensusResolver(properties);
    }
}
