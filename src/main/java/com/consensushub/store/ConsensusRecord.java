package com.consensushub.store;

import com.consensushub.contract.BroadcastStatus;
import com.consensushub.contract.ConsensusMethod;
import com.consensushub.contract.DecisionStatus;
import com.consensushub.contract.NodeDecision;
import com.consensushub.contract.Payloads;
import com.consensushub.graph.DecisionGraph;
import com.consensushub.orchestration.OrchestrationResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stored form of one round: the inputs, the graph and the orchestration
 * result, plus lifecycle fields that later updates may change.
 *
 * The round inputs and the consensus numbers are fixed at creation so the
 * outcome stays reproducible from the stored inputs. Lifecycle changes are
 * applied by the store only and each one is appended to {@link #getHistory()}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConsensusRecord {

    private final OrchestrationResult result;
    private final String decisionType;
    private final String initiatorNode;
    private final List<NodeDecision> nodeDecisions;
    private final DecisionGraph decisionGraph;

    private DecisionStatus status;
    private Map<String, Object> executionResults;
    private Double actualImpact;
    private Double performanceGain;
    private BroadcastStatus broadcastStatus = BroadcastStatus.PENDING;
    private List<String> broadcastedTo = List.of();
    private Map<String, String> broadcastAcknowledgments = Map.of();
    private Instant storedAt;
    private Instant executedAt;
    private Instant broadcastedAt;
    private final List<StatusTransition> history = new ArrayList<>();

    public ConsensusRecord(OrchestrationResult result, String decisionType, String initiatorNode,
                           List<NodeDecision> nodeDecisions, DecisionGraph decisionGraph) {
        this.result = result;
        this.decisionType = decisionType;
        this.initiatorNode = initiatorNode;
        this.nodeDecisions = List.copyOf(nodeDecisions);
        this.decisionGraph = decisionGraph;
        this.status = result.status();
    }

    /**
     * Applies a lifecycle update in place. Every field the update changes is
     * appended to the history, status changes first.
     *
     * @throws IllegalTransitionException if the status change is not an allowed transition
     */
    void apply(StatusUpdate update, Instant now) {
        if (update.status() != null && update.status() != status) {
            if (!status.canTransitionTo(update.status())) {
                throw new IllegalTransitionException("Illegal status transition for " + getConsensusId()
                    + ": " + status.getValue() + " -> " + update.status().getValue());
            }
            history.add(new StatusTransition("status", status.getValue(), update.status().getValue(), now));
            status = update.status();
            if (status == DecisionStatus.EXECUTED) {
                executedAt = now;
            }
        }
        if (update.broadcastStatus() != null && update.broadcastStatus() != broadcastStatus) {
            history.add(new StatusTransition("broadcast_status",
                broadcastStatus.getValue(), update.broadcastStatus().getValue(), now));
            broadcastStatus = update.broadcastStatus();
            if (broadcastStatus == BroadcastStatus.COMPLETED) {
                broadcastedAt = now;
            }
        }
        if (update.executionResults() != null) {
            Map<String, Object> next = Payloads.freeze(update.executionResults());
            recordChange("execution_results", executionResults, next, now);
            executionResults = next;
        }
        if (update.actualImpact() != null) {
            recordChange("actual_impact", actualImpact, update.actualImpact(), now);
            actualImpact = update.actualImpact();
        }
        if (update.performanceGain() != null) {
            recordChange("performance_gain", performanceGain, update.performanceGain(), now);
            performanceGain = update.performanceGain();
        }
        if (update.broadcastedTo() != null) {
            List<String> next = List.copyOf(update.broadcastedTo());
            recordChange("broadcasted_to", broadcastedTo, next, now);
            broadcastedTo = next;
        }
        if (update.broadcastAcknowledgments() != null) {
            Map<String, String> next = Collections.unmodifiableMap(new LinkedHashMap<>(update.broadcastAcknowledgments()));
            recordChange("broadcast_acknowledgments", broadcastAcknowledgments, next, now);
            broadcastAcknowledgments = next;
        }
    }

    private void recordChange(String field, Object from, Object to, Instant now) {
        if (!Objects.equals(from, to)) {
            history.add(new StatusTransition(field, describe(from), describe(to), now));
        }
    }

    private static String describe(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    ConsensusRecord copy() {
        ConsensusRecord copy = new ConsensusRecord(result, decisionType, initiatorNode, nodeDecisions, decisionGraph);
        copy.status = status;
        copy.executionResults = executionResults;
        copy.actualImpact = actualImpact;
        copy.performanceGain = performanceGain;
        copy.broadcastStatus = broadcastStatus;
        copy.broadcastedTo = broadcastedTo;
        copy.broadcastAcknowledgments = broadcastAcknowledgments;
        copy.storedAt = storedAt;
        copy.executedAt = executedAt;
        copy.broadcastedAt = broadcastedAt;
        copy.history.addAll(history);
        return copy;
    }

    void setStoredAt(Instant storedAt) {
        this.storedAt = storedAt;
    }

    public String getConsensusId() {
        return result.consensusId();
    }

    public OrchestrationResult getResult() {
        return result;
    }

    public String getDecisionType() {
        return decisionType;
    }

    public String getInitiatorNode() {
        return initiatorNode;
    }

    public ConsensusMethod getConsensusMethod() {
        return result.consensusMethod();
    }

    public List<NodeDecision> getNodeDecisions() {
        return nodeDecisions;
    }

    public DecisionGraph getDecisionGraph() {
        return decisionGraph;
    }

    public DecisionStatus getStatus() {
        return status;
    }

    public Map<String, Object> getExecutionResults() {
        return executionResults;
    }

    public Double getActualImpact() {
        return actualImpact;
    }

    public Double getPerformanceGain() {
        return performanceGain;
    }

    public BroadcastStatus getBroadcastStatus() {
        return broadcastStatus;
    }

    public List<String> getBroadcastedTo() {
        return broadcastedTo;
    }

    public Map<String, String> getBroadcastAcknowledgments() {
        return broadcastAcknowledgments;
    }

    public Instant getStoredAt() {
        return storedAt;
    }

    public Instant getExecutedAt() {
        return executedAt;
    }

    public Instant getBroadcastedAt() {
        return broadcastedAt;
    }

    public List<StatusTransition> getHistory() {
        return Collections.unmodifiableList(history);
    }
}
