package com.consensushub.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Map;

/**
 * A final decision as received by a node, with the checksum it came with.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChecksumVerificationRequest(
    String consensusId,
    Map<String, Object> finalDecision,
    String checksum
) {}
