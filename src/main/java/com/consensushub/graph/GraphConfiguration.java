package com.consensushub.graph;

import com.consensushub.contract.OrchestrationRequestValidator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GraphConfiguration {

    @Bean
    public DecisionGraphBuilder decisionGraphBuilder(GraphProperties properties,
                                                     OrchestrationRequestValidator validator) {
        return new DecisionGraphBuilder(properties.opposingTypesTable(), validator);
    }

    @Bean
    public GraphAnalyzer graphAnalyzer(GraphProperties properties) {
        return new GraphAnalyzer(properties.getCriticalWeight());
    }
}
