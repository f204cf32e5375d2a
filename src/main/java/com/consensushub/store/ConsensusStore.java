package com.consensushub.store;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for consensus rounds. Implementations signal failures
 * with {@link PersistenceException}.
 */
public interface ConsensusStore {

    /** Stores a new round and returns the stored copy with its timestamp. */
    ConsensusRecord store(ConsensusRecord record);

    Optional<ConsensusRecord> get(String consensusId);

    /**
     * @return the updated record, or empty if the id is unknown
     * @throws IllegalTransitionException if the update holds an illegal status transition
     */
    Optional<ConsensusRecord> updateStatus(String consensusId, StatusUpdate update);

    /** Newest first. */
    List<ConsensusRecord> listRecent(int limit);

    ConsensusStatistics aggregateStatistics();
}
