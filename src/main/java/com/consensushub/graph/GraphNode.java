package com.consensushub.graph;

import com.consensushub.contract.NodeDecision;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * A proposal placed in the graph, with its derived weight
 * {@code (0.6 * confidence + 0.4 * expectedImpact) * priority}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GraphNode(
    String nodeId,
    NodeDecision decision,
    double weight,
    List<Connection> connections
) {

    public GraphNode {
        connections = List.copyOf(connections);
    }
}
