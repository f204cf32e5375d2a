package com.consensushub.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Voting rule used to turn per-node votes into an agreement ratio.
 */
public enum ConsensusMethod {
    WEIGHTED_VOTE("weighted-vote"),
    UNANIMOUS("unanimous"),
    MAJORITY("majority"),
    QUORUM("quorum");

    private final String value;

    ConsensusMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConsensusMethod fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown consensus method: " + raw));
    }

    public static ConsensusMethod orDefault(ConsensusMethod method) {
        return method != null ? method : WEIGHTED_VOTE;
    }
}
