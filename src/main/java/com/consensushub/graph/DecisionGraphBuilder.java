package com.consensushub.graph;

import com.consensushub.contract.NodeDecision;
import com.consensushub.contract.OrchestrationRequestValidator;
import com.consensushub.contract.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the relationship graph of a round from its flat list of proposals.
 *
 * Every unordered pair is classified once, first match wins:
 * <ol>
 *   <li>explicit dependency (either side lists the other) - depends, 0.9</li>
 *   <li>explicit conflict (either side lists the other) - conflicts, 0.9</li>
 *   <li>same decision type - supports, 0.6</li>
 *   <li>opposing decision types - conflicts, 0.7</li>
 *   <li>payload similarity above 0.7 - supports with that strength; below 0.3 -
 *       conflicts with strength {@code 1 - similarity}; otherwise neutral</li>
 * </ol>
 * Non-neutral pairs become a connection on both nodes.
 */
public class DecisionGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DecisionGraphBuilder.class);

    static final double EXPLICIT_STRENGTH = 0.9;
    static final double SAME_TYPE_STRENGTH = 0.6;
    static final double OPPOSING_TYPE_STRENGTH = 0.7;
    static final double SUPPORT_SIMILARITY = 0.7;
    static final double CONFLICT_SIMILARITY = 0.3;

    private static final int MIN_DECISIONS = 2;

    private final OpposingTypesTable opposingTypes;
    private final OrchestrationRequestValidator validator;

    public DecisionGraphBuilder(OpposingTypesTable opposingTypes, OrchestrationRequestValidator validator) {
        this.opposingTypes = opposingTypes;
        this.validator = validator;
    }

    public DecisionGraph build(List<NodeDecision> decisions) {
        if (decisions == null || decisions.size() < MIN_DECISIONS) {
            throw new ValidationException("At least " + MIN_DECISIONS + " decisions are needed to build a graph");
        }
        validator.validateDecisions(decisions);

        int size = decisions.size();
        List<List<Connection>> connections = new ArrayList<>(size);
        double totalWeight = 0;
        for (NodeDecision decision : decisions) {
            totalWeight += weightOf(decision);
            connections.add(new ArrayList<>());
        }

        int interconnections = 0;
        int conflictCount = 0;
        int supportCount = 0;

        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                NodeDecision first = decisions.get(i);
                NodeDecision second = decisions.get(j);
                Relationship relationship = classify(first, second);
                if (relationship.type() == RelationshipType.NEUTRAL) {
                    continue;
                }

                connections.get(i).add(new Connection(second.nodeId(), relationship.type(), relationship.strength()));
                connections.get(j).add(new Connection(first.nodeId(), relationship.type(), relationship.strength()));
                interconnections++;

                if (relationship.type() == RelationshipType.CONFLICTS) {
                    conflictCount++;
                } else if (relationship.type() == RelationshipType.SUPPORTS) {
                    supportCount++;
                }
            }
        }

        List<GraphNode> nodes = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            NodeDecision decision = decisions.get(i);
            nodes.add(new GraphNode(decision.nodeId(), decision, weightOf(decision), connections.get(i)));
        }

        log.info("Built decision graph: nodes={}, interconnections={}, conflicts={}, supports={}",
            size, interconnections, conflictCount, supportCount);

        return new DecisionGraph(nodes, totalWeight, interconnections, conflictCount, supportCount, Instant.now());
    }

    public static double weightOf(NodeDecision decision) {
        return ((decision.confidence() * 0.6) + (decision.expectedImpact() * 0.4)) * decision.effectivePriority();
    }

    Relationship classify(NodeDecision first, NodeDecision second) {
        if (first.dependsOn(second.nodeId()) || second.dependsOn(first.nodeId())) {
            return new Relationship(RelationshipType.DEPENDS, EXPLICIT_STRENGTH);
        }
        if (first.conflictsWith(second.nodeId()) || second.conflictsWith(first.nodeId())) {
            return new Relationship(RelationshipType.CONFLICTS, EXPLICIT_STRENGTH);
        }
        if (first.decisionType().equals(second.decisionType())) {
            return new Relationship(RelationshipType.SUPPORTS, SAME_TYPE_STRENGTH);
        }
        if (opposingTypes.opposes(first.decisionType(), second.decisionType())) {
            return new Relationship(RelationshipType.CONFLICTS, OPPOSING_TYPE_STRENGTH);
        }

        double similarity = PayloadSimilarity.of(first.payload(), second.payload());
        if (similarity > SUPPORT_SIMILARITY) {
            return new Relationship(RelationshipType.SUPPORTS, similarity);
        }
        if (similarity < CONFLICT_SIMILARITY) {
            return new Relationship(RelationshipType.CONFLICTS, 1 - similarity);
        }
        return new Relationship(RelationshipType.NEUTRAL, similarity);
    }

    record Relationship(RelationshipType type, double strength) {}
}
