package com.consensushub.graph;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Read-only signals derived from a {@link DecisionGraph}.
 *
 * @param conflictLevel fraction of edges that are conflicts, 0 without edges
 * @param coherenceScore fraction of edges that are supports, 1 without edges
 * @param criticalNodes node ids above the critical weight, heaviest first
 * @param recommendations advisory text only, never used to gate a result
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GraphAnalysisResult(
    DecisionGraph graph,
    double conflictLevel,
    double coherenceScore,
    List<String> criticalNodes,
    List<ConflictingPair> conflictingPairs,
    List<String> recommendations
) {

    public GraphAnalysisResult {
        criticalNodes = List.copyOf(criticalNodes);
        conflictingPairs = List.copyOf(conflictingPairs);
        recommendations = List.copyOf(recommendations);
    }
}
