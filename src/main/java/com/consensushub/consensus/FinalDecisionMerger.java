package com.consensushub.consensus;

import com.consensushub.contract.NodeDecision;
import com.consensushub.contract.Payloads;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the approved proposals of a round into a single decision.
 *
 * Same decision type: payloads merge key by key, numbers are averaged and
 * any other value keeps the first one seen. Mixed types: the approved
 * proposal with the highest vote weight wins, the others are listed as
 * supporting nodes.
 */
public final class FinalDecisionMerger {

    public static final String NO_DECISION = "no-decision";
    public static final String SOURCE_COLLECTIVE = "collective-consensus";
    public static final String SOURCE_WEIGHTED = "weighted-consensus";

    private FinalDecisionMerger() {
    }

    public static Map<String, Object> merge(List<NodeDecision> decisions, Map<String, VotingResult> votes) {
        List<NodeDecision> approved = decisions.stream()
            .filter(d -> votes.containsKey(d.nodeId()) && votes.get(d.nodeId()).approves())
            .toList();

        Map<String, Object> decision = new LinkedHashMap<>();
        if (approved.isEmpty()) {
            decision.put("decision_type", NO_DECISION);
            decision.put("payload", Map.of());
            decision.put("reason", "No approved decisions");
            return Payloads.freeze(decision);
        }

        String firstType = approved.get(0).decisionType();
        boolean sameType = approved.stream().allMatch(d -> d.decisionType().equals(firstType));

        if (sameType) {
            decision.put("decision_type", firstType);
            decision.put("payload", mergePayloads(approved.stream().map(NodeDecision::payload).toList()));
            decision.put("participating_nodes", approved.stream().map(NodeDecision::nodeId).toList());
            decision.put("source", SOURCE_COLLECTIVE);
            return Payloads.freeze(decision);
        }

        NodeDecision primary = approved.get(0);
        for (NodeDecision candidate : approved) {
            if (votes.get(candidate.nodeId()).weight() > votes.get(primary.nodeId()).weight()) {
                primary = candidate;
            }
        }
        String primaryId = primary.nodeId();

        decision.put("decision_type", primary.decisionType());
        decision.put("payload", primary.payload() != null ? primary.payload() : Map.of());
        decision.put("primary_node", primaryId);
        decision.put("supporting_nodes", approved.stream()
            .map(NodeDecision::nodeId)
            .filter(id -> !id.equals(primaryId))
            .toList());
        decision.put("source", SOURCE_WEIGHTED);
        return Payloads.freeze(decision);
    }

    static Map<String, Object> mergePayloads(List<Map<String, Object>> payloads) {
        List<Map<String, Object>> present = payloads.stream()
            .filter(p -> p != null)
            .toList();
        if (present.isEmpty()) {
            return Map.of();
        }
        if (present.size() == 1) {
            return Payloads.freeze(present.get(0));
        }

        Map<String, Object> merged = new LinkedHashMap<>();
        Map<String, List<Number>> numbers = new LinkedHashMap<>();
        for (Map<String, Object> payload : present) {
            for (Map.Entry<String, Object> entry : payload.entrySet()) {
                String key = entry.getKey();
                Object value = entry.getValue();
                if (!merged.containsKey(key)) {
                    merged.put(key, value);
                    if (value instanceof Number n) {
                        numbers.computeIfAbsent(key, k -> new ArrayList<>()).add(n);
                    }
                } else if (numbers.containsKey(key) && value instanceof Number n) {
                    numbers.get(key).add(n);
                }
            }
        }

        numbers.forEach((key, values) -> merged.put(key, mean(values)));
        return Payloads.freeze(merged);
    }

    private static Number mean(List<Number> values) {
        double sum = 0;
        boolean integral = true;
        for (Number value : values) {
            sum += value.doubleValue();
            integral &= isIntegral(value);
        }
        double mean = sum / values.size();
        if (integral && mean == Math.rint(mean) && Math.abs(mean) <= Long.MAX_VALUE) {
            return (long) mean;
        }
        return mean;
    }

    private static boolean isIntegral(Number value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger;
    }
}
