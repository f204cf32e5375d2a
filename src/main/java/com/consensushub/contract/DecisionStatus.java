package com.consensushub.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a consensus round. A round ends in APPROVED or REVIEW_REQUIRED;
 * the remaining values are reached only through later lifecycle updates.
 */
public enum DecisionStatus {
    APPROVED("approved"),
    REVIEW_REQUIRED("review_required"),
    REJECTED("rejected"),
    EXECUTED("executed"),
    EXECUTION_FAILED("execution_failed");

    private final String value;

    DecisionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Allowed lifecycle successors. Terminal states have none. */
    public Set<DecisionStatus> successors() {
        return switch (this) {
            case REVIEW_REQUIRED -> EnumSet.of(APPROVED, REJECTED);
            case APPROVED -> EnumSet.of(EXECUTED, EXECUTION_FAILED);
            case REJECTED, EXECUTED, EXECUTION_FAILED -> EnumSet.noneOf(DecisionStatus.class);
        };
    }

    public boolean canTransitionTo(DecisionStatus next) {
        return successors().contains(next);
    }

    @JsonCreator
    public static DecisionStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown decision status: " + raw));
    }
}
