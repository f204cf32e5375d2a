package com.consensushub.graph;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One side of an undirected edge, as seen from the owning node.
 *
 * @param strength in [0, 1]
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Connection(
    String nodeId,
    RelationshipType relationshipType,
    double strength
) {}
