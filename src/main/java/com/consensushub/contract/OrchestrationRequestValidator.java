package com.consensushub.contract;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a round's input before any graph is built. Every failure is a
 * {@link ValidationException}; out-of-range scores are never clamped.
 */
@Component
public class OrchestrationRequestValidator {

    public void validate(OrchestrationRequest request, int minNodes) {
        requireNonNull(request, "request cannot be null");
        requireString(request.initiatorNode(), "initiator_node is required");
        requireString(request.decisionType(), "decision_type is required");

        List<NodeDecision> decisions = request.nodeDecisions();
        if (decisions == null || decisions.size() < minNodes) {
            throw new ValidationException("At least " + minNodes + " node decisions required");
        }

        validateDecisions(decisions);
    }

    /**
     * Checks a round's proposals: no null entries, every node_id present and
     * unique, and every node within range.
     */
    public void validateDecisions(List<NodeDecision> decisions) {
        Set<String> seen = new HashSet<>();
        for (NodeDecision decision : decisions) {
            requireNonNull(decision, "node_decisions cannot contain null entries");
            requireString(decision.nodeId(), "node_id is required for all decisions");
            if (!seen.add(decision.nodeId())) {
                throw new ValidationException(
                    "Duplicate node_id in round: " + decision.nodeId(), decision.nodeId());
            }
            validateDecision(decision);
        }
    }

    /**
     * Per-node range checks.
     */
    public void validateDecision(NodeDecision decision) {
        String nodeId = decision.nodeId();
        if (decision.decisionType() == null || decision.decisionType().isBlank()) {
            throw new ValidationException("Missing decision_type for node " + nodeId, nodeId);
        }
        requireUnitInterval(decision.confidence(),
            "Invalid confidence for node " + nodeId + ": must be between 0 and 1", nodeId);
        requireUnitInterval(decision.expectedImpact(),
            "Invalid expected impact for node " + nodeId + ": must be between 0 and 1", nodeId);
        if (decision.priority() != null && !(decision.priority() > 0)) {
            throw new ValidationException(
                "Invalid priority for node " + nodeId + ": must be greater than 0", nodeId);
        }
    }

    private void requireUnitInterval(Double value, String message, String nodeId) {
        if (value == null || value.isNaN() || value < 0.0 || value > 1.0) {
            throw new ValidationException(message, nodeId);
        }
    }

    private String requireString(Object value, String message) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ValidationException(message);
        }
        return text;
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ValidationException(message);
        }
    }
}
