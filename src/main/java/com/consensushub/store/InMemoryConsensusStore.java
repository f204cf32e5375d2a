package com.consensushub.store;

import com.consensushub.contract.DecisionStatus;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Component
public class InMemoryConsensusStore implements ConsensusStore {

    private final ConcurrentHashMap<String, ConsensusRecord> records = new ConcurrentHashMap<>();

    @Override
    public ConsensusRecord store(ConsensusRecord record) {
        ConsensusRecord stored = record.copy();
        stored.setStoredAt(Instant.now());
        if (records.putIfAbsent(stored.getConsensusId(), stored) != null) {
            throw new PersistenceException("consensus_id already stored: " + stored.getConsensusId());
        }
        return stored.copy();
    }

    @Override
    public Optional<ConsensusRecord> get(String consensusId) {
        return Optional.ofNullable(records.get(consensusId)).map(ConsensusRecord::copy);
    }

    @Override
    public Optional<ConsensusRecord> updateStatus(String consensusId, StatusUpdate update) {
        ConsensusRecord updated = records.computeIfPresent(consensusId, (id, existing) -> {
            ConsensusRecord next = existing.copy();
            next.apply(update, Instant.now());
            return next;
        });
        return Optional.ofNullable(updated).map(ConsensusRecord::copy);
    }

    @Override
    public List<ConsensusRecord> listRecent(int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return records.values().stream()
            .sorted(Comparator.comparing(ConsensusRecord::getStoredAt).reversed()
                .thenComparing(ConsensusRecord::getConsensusId))
            .limit(limit)
            .map(ConsensusRecord::copy)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public ConsensusStatistics aggregateStatistics() {
        List<ConsensusRecord> all = new ArrayList<>(records.values());

        double avgAgreement = all.stream()
            .mapToDouble(r -> r.getResult().agreementRatio())
            .average()
            .orElse(0.0);
        double avgConflict = all.stream()
            .mapToDouble(r -> r.getResult().conflictLevel())
            .average()
            .orElse(0.0);

        return new ConsensusStatistics(
            all.size(),
            countStatus(all, DecisionStatus.APPROVED),
            countStatus(all, DecisionStatus.REVIEW_REQUIRED),
            countStatus(all, DecisionStatus.REJECTED),
            countStatus(all, DecisionStatus.EXECUTED),
            avgAgreement,
            avgConflict,
            all.stream().filter(r -> r.getResult().governanceApproved()).count()
        );
    }

    private long countStatus(List<ConsensusRecord> all, DecisionStatus status) {
        return all.stream().filter(r -> r.getStatus() == status).count();
    }
}
