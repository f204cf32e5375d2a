package com.consensushub.graph;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Weighted, undirected relationship graph of one round. Built once and
 * never modified afterwards.
 *
 * @param interconnections number of non-neutral node pairs
 * @param conflictCount pairs classified as conflicts, counted once per pair
 * @param supportCount pairs classified as supports, counted once per pair
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DecisionGraph(
    List<GraphNode> nodes,
    double totalWeight,
    int interconnections,
    int conflictCount,
    int supportCount,
    Instant builtAt
) {

    public DecisionGraph {
        nodes = List.copyOf(nodes);
    }

    public Optional<GraphNode> findNode(String nodeId) {
        return nodes.stream()
            .filter(n -> n.nodeId().equals(nodeId))
            .findFirst();
    }
}
