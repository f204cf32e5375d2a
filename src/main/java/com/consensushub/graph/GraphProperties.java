package com.consensushub.graph;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "consensus-hub.graph")
public class GraphProperties {

    private double criticalWeight = 0.7;
    private Map<String, List<String>> opposingTypes = new LinkedHashMap<>();

    public double getCriticalWeight() {
        return criticalWeight;
    }

    public void setCriticalWeight(double criticalWeight) {
        this.criticalWeight = criticalWeight;
    }

    public Map<String, List<String>> getOpposingTypes() {
        return opposingTypes;
    }

    public void setOpposingTypes(Map<String, List<String>> opposingTypes) {
        this.opposingTypes = opposingTypes;
    }

    /** The configured table, or the built-in one when none is configured. */
    public OpposingTypesTable opposingTypesTable() {
        return opposingTypes == null || opposingTypes.isEmpty()
            ? OpposingTypesTable.defaults()
            : new OpposingTypesTable(opposingTypes);
    }
}
