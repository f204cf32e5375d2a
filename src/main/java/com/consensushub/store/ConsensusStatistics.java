package com.consensushub.store;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ConsensusStatistics(
    long total,
    long approved,
    long reviewRequired,
    long rejected,
    long executed,
    double avgAgreementRatio,
    double avgConflictLevel,
    long governanceApprovedCount
) {}
