package com.consensushub.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of the relationship between two proposals of a round.
 * NEUTRAL pairs are never recorded as edges.
 */
public enum RelationshipType {
    SUPPORTS("supports"),
    CONFLICTS("conflicts"),
    DEPENDS("depends"),
    NEUTRAL("neutral");

    private final String value;

    RelationshipType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
