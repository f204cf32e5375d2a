package com.consensushub.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum BroadcastStatus {
    PENDING("pending"),
    BROADCASTING("broadcasting"),
    COMPLETED("completed"),
    PARTIAL("partial"),
    FAILED("failed");

    private final String value;

    BroadcastStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static BroadcastStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unknown broadcast status: " + raw));
    }
}
