package com.consensushub.consensus;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Vote derived for a node from its confidence and the round's conflict level.
 * Nodes never cast votes directly.
 */
public enum Vote {
    APPROVE("approve"),
    REJECT("reject"),
    ABSTAIN("abstain");

    private final String value;

    Vote(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
