package com.consensushub.contract;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One node's proposal for a round.
 *
 * The payload is an ordered key-value map whose leaves are strings, numbers,
 * booleans or nested maps. Only top-level keys take part in similarity and
 * merge heuristics.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NodeDecision(
    String nodeId,
    String nodeName,
    String decisionType,
    Map<String, Object> payload,
    Double confidence,
    Double expectedImpact,
    Double priority,
    Set<String> dependencies,
    Set<String> conflicts
) {

    public NodeDecision {
        payload = Payloads.freeze(payload);
        dependencies = dependencies == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        conflicts = conflicts == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(conflicts));
    }

    public static NodeDecision of(String nodeId, String decisionType, Map<String, Object> payload,
                                  double confidence, double expectedImpact) {
        return new NodeDecision(nodeId, nodeId, decisionType, payload, confidence, expectedImpact, null, null, null);
    }

    /** Priority multiplier, 1 when absent. */
    public double effectivePriority() {
        return priority != null ? priority : 1.0;
    }

    public boolean dependsOn(String otherNodeId) {
        return dependencies.contains(otherNodeId);
    }

    public boolean conflictsWith(String otherNodeId) {
        return conflicts.contains(otherNodeId);
    }
}
