package com.consensushub.store;

import com.consensushub.consensus.DecisionChecksum;
import com.consensushub.contract.BroadcastStatus;
import com.consensushub.contract.ConsensusMethod;
import com.consensushub.contract.DecisionStatus;
import com.consensushub.contract.NodeDecision;
import com.consensushub.orchestration.OrchestrationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryConsensusStoreTest {

    private InMemoryConsensusStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryConsensusStore();
    }

    @Test
    void storeAndGet_roundTripsTheRecord() {
        ConsensusRecord stored = store.store(record("c-1", DecisionStatus.APPROVED, 0.9, 0.0, true));

        assertNotNull(stored.getStoredAt());
        ConsensusRecord loaded = store.get("c-1").orElseThrow();
        assertEquals("scale-up", loaded.getDecisionType());
        assertEquals("hub", loaded.getInitiatorNode());
        assertEquals(DecisionStatus.APPROVED, loaded.getStatus());
        assertEquals(BroadcastStatus.PENDING, loaded.getBroadcastStatus());
        assertEquals(2, loaded.getNodeDecisions().size());
    }

    @Test
    void duplicateId_isRejected() {
        store.store(record("c-1", DecisionStatus.APPROVED, 0.9, 0.0, true));

        assertThrows(PersistenceException.class,
            () -> store.store(record("c-1", DecisionStatus.APPROVED, 0.9, 0.0, true)));
    }

    @Test
    void unknownId_isEmpty() {
        assertTrue(store.get("missing").isEmpty());
        assertTrue(store.updateStatus("missing", StatusUpdate.status(DecisionStatus.EXECUTED)).isEmpty());
    }

    @Nested
    @DisplayName("Lifecycle updates")
    class Lifecycle {

        @BeforeEach
        void seed() {
            store.store(record("approved", DecisionStatus.APPROVED, 0.9, 0.0, true));
            store.store(record("review", DecisionStatus.REVIEW_REQUIRED, 0.4, 0.8, false));
        }

        @Test
        void execution_stampsTimeAndHistory() {
            ConsensusRecord updated = store.updateStatus("approved", new StatusUpdate(DecisionStatus.EXECUTED,
                Map.of("applied", true), 0.6, 0.12, null, null, null)).orElseThrow();

            assertEquals(DecisionStatus.EXECUTED, updated.getStatus());
            assertNotNull(updated.getExecutedAt());
            assertEquals(0.6, updated.getActualImpact());
            assertEquals(0.12, updated.getPerformanceGain());
            assertEquals(List.of("status", "execution_results", "actual_impact", "performance_gain"),
                updated.getHistory().stream().map(StatusTransition::field).toList());
            StatusTransition transition = updated.getHistory().get(0);
            assertEquals("approved", transition.from());
            assertEquals("executed", transition.to());
        }

        @Test
        void outcomeOnlyUpdate_isRecordedInHistory() {
            ConsensusRecord updated = store.updateStatus("approved", new StatusUpdate(null,
                Map.of("ok", true), 0.5, 0.1, null, null, null)).orElseThrow();

            assertEquals(DecisionStatus.APPROVED, updated.getStatus());
            assertEquals(Map.of("ok", true), updated.getExecutionResults());
            assertEquals(3, updated.getHistory().size());
            StatusTransition results = updated.getHistory().get(0);
            assertEquals("execution_results", results.field());
            assertNull(results.from());
            assertEquals("{ok=true}", results.to());
            assertEquals("0.5", updated.getHistory().get(1).to());
        }

        @Test
        void repeatedValue_addsNoHistory() {
            store.updateStatus("approved", new StatusUpdate(null, null, 0.5, null, null, null, null));

            ConsensusRecord updated = store.updateStatus("approved",
                new StatusUpdate(null, null, 0.5, null, null, null, null)).orElseThrow();

            assertEquals(1, updated.getHistory().size());
        }

        @Test
        void broadcastTargetsOnly_areRecorded() {
            ConsensusRecord updated = store.updateStatus("approved", StatusUpdate.broadcast(
                null, List.of("n1"), null)).orElseThrow();

            assertEquals(BroadcastStatus.PENDING, updated.getBroadcastStatus());
            assertEquals("broadcasted_to", updated.getHistory().get(0).field());
            assertEquals("[]", updated.getHistory().get(0).from());
        }

        @Test
        void illegalTransition_isRefusedAndLeavesRecordUntouched() {
            assertThrows(IllegalTransitionException.class,
                () -> store.updateStatus("review", StatusUpdate.status(DecisionStatus.EXECUTED)));

            ConsensusRecord unchanged = store.get("review").orElseThrow();
            assertEquals(DecisionStatus.REVIEW_REQUIRED, unchanged.getStatus());
            assertTrue(unchanged.getHistory().isEmpty());
        }

        @Test
        void reviewedRound_canBeRejected() {
            ConsensusRecord updated = store.updateStatus("review",
                StatusUpdate.status(DecisionStatus.REJECTED)).orElseThrow();

            assertEquals(DecisionStatus.REJECTED, updated.getStatus());
        }

        @Test
        void broadcastCompletion_stampsTime() {
            ConsensusRecord updated = store.updateStatus("approved", StatusUpdate.broadcast(
                BroadcastStatus.COMPLETED, List.of("n1", "n2"), Map.of("n1", "ack", "n2", "ack"))).orElseThrow();

            assertEquals(BroadcastStatus.COMPLETED, updated.getBroadcastStatus());
            assertNotNull(updated.getBroadcastedAt());
            assertEquals(List.of("n1", "n2"), updated.getBroadcastedTo());
            assertEquals("broadcast_status", updated.getHistory().get(0).field());
        }

        @Test
        void updatesNeverTouchConsensusNumbers() {
            ConsensusRecord before = store.get("approved").orElseThrow();

            ConsensusRecord after = store.updateStatus("approved",
                StatusUpdate.status(DecisionStatus.EXECUTED)).orElseThrow();

            assertEquals(before.getResult(), after.getResult());
        }

        @Test
        void statisticsFollowCurrentStatus() {
            store.updateStatus("approved", StatusUpdate.status(DecisionStatus.EXECUTED));

            ConsensusStatistics stats = store.aggregateStatistics();

            assertEquals(2, stats.total());
            assertEquals(0, stats.approved());
            assertEquals(1, stats.executed());
            assertEquals(1, stats.reviewRequired());
            assertEquals(0.65, stats.avgAgreementRatio(), 1e-9);
            assertEquals(0.4, stats.avgConflictLevel(), 1e-9);
            assertEquals(1, stats.governanceApprovedCount());
        }
    }

    @Test
    void storedDecisionCannotBeChangedThroughReads() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("replicas", 6L);
        payload.put("limits", new LinkedHashMap<>(Map.of("cpu", 2)));
        Map<String, Object> decision = new LinkedHashMap<>();
        decision.put("decision_type", "scale-up");
        decision.put("payload", payload);
        String checksum = DecisionChecksum.of(decision);
        store.store(record("c-1", decision, checksum));
        payload.put("replicas", 99);

        ConsensusRecord loaded = store.get("c-1").orElseThrow();
        @SuppressWarnings("unchecked")
        Map<String, Object> storedPayload = (Map<String, Object>) loaded.getResult().finalDecision().get("payload");
        @SuppressWarnings("unchecked")
        Map<String, Object> limits = (Map<String, Object>) storedPayload.get("limits");

        assertThrows(UnsupportedOperationException.class, () -> storedPayload.put("replicas", 99));
        assertThrows(UnsupportedOperationException.class, () -> limits.put("cpu", 64));
        assertEquals(6L, storedPayload.get("replicas"));
        assertTrue(DecisionChecksum.verify(store.get("c-1").orElseThrow().getResult().finalDecision(), checksum));
    }

    @Test
    void emptyStore_hasZeroStatistics() {
        ConsensusStatistics stats = store.aggregateStatistics();

        assertEquals(0, stats.total());
        assertEquals(0.0, stats.avgAgreementRatio());
    }

    @Test
    void listRecent_isNewestFirstAndLimited() throws InterruptedException {
        store.store(record("c-1", DecisionStatus.APPROVED, 0.9, 0.0, true));
        Thread.sleep(5);
        store.store(record("c-2", DecisionStatus.APPROVED, 0.9, 0.0, true));
        Thread.sleep(5);
        store.store(record("c-3", DecisionStatus.APPROVED, 0.9, 0.0, true));

        List<ConsensusRecord> recent = store.listRecent(2);

        assertEquals(List.of("c-3", "c-2"), recent.stream().map(ConsensusRecord::getConsensusId).toList());
        assertTrue(store.listRecent(0).isEmpty());
    }

    static ConsensusRecord record(String id, Map<String, Object> finalDecision, String checksum) {
        OrchestrationResult result = new OrchestrationResult(id, DecisionStatus.APPROVED, true,
            ConsensusMethod.WEIGHTED_VOTE, 1.0, finalDecision, 0.95, checksum, Map.of(), List.of("n1", "n2"),
            0.0, 1.0, true, null, List.of(), Instant.now());
        return new ConsensusRecord(result, "scale-up", "hub", List.of(), null);
    }

    static ConsensusRecord record(String id, DecisionStatus status, double agreement, double conflict,
                                  boolean governanceApproved) {
        OrchestrationResult result = new OrchestrationResult(id, status, true, ConsensusMethod.WEIGHTED_VOTE,
            agreement, Map.of("decision_type", "scale-up"), 0.8, "abc", Map.of(), List.of("n1", "n2"),
            conflict, 1.0 - conflict, governanceApproved, null, List.of(), Instant.now());
        List<NodeDecision> decisions = List.of(
            NodeDecision.of("n1", "scale-up", Map.of("replicas", 5), 0.9, 0.8),
            NodeDecision.of("n2", "scale-up", Map.of("replicas", 7), 0.85, 0.7));
        return new ConsensusRecord(result, "scale-up", "hub", decisions, null);
    }
}
