package com.consensushub.store;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * One entry of a record's append-only lifecycle history.
 *
 * @param field "status" or "broadcast_status"
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StatusTransition(
    String field,
    String from,
    String to,
    Instant at
) {}
