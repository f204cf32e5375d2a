package com.consensushub.store;

import com.consensushub.contract.BroadcastStatus;
import com.consensushub.contract.DecisionStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Map;

/**
 * Partial lifecycle update reported after a round, e.g. by the executor or the
 * broadcaster. Null fields are left untouched.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatusUpdate(
    DecisionStatus status,
    Map<String, Object> executionResults,
    Double actualImpact,
    Double performanceGain,
    BroadcastStatus broadcastStatus,
    List<String> broadcastedTo,
    Map<String, String> broadcastAcknowledgments
) {

    public static StatusUpdate status(DecisionStatus status) {
        return new StatusUpdate(status, null, null, null, null, null, null);
    }

    public static StatusUpdate broadcast(BroadcastStatus broadcastStatus, List<String> broadcastedTo,
                                         Map<String, String> acknowledgments) {
        return new StatusUpdate(null, null, null, null, broadcastStatus, broadcastedTo, acknowledgments);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return status == null && executionResults == null && actualImpact == null
            && performanceGain == null && broadcastStatus == null
            && broadcastedTo == null && broadcastAcknowledgments == null;
    }
}
