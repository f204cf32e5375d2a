package com.consensushub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ConsensusHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConsensusHubApplication.class, args);
    }
}
