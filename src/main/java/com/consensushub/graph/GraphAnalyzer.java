package com.consensushub.graph;

import com.consensushub.contract.NodeDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives conflict, coherence, critical nodes and advisory recommendations
 * from a built graph. Pure function of its input.
 */
public class GraphAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(GraphAnalyzer.class);

    static final double HIGH_CONFLICT = 0.5;
    static final double MODERATE_CONFLICT = 0.3;
    static final double HIGH_COHERENCE = 0.8;
    static final double LOW_COHERENCE = 0.5;
    private static final int TOP_CRITICAL = 3;

    private final double criticalWeight;

    public GraphAnalyzer(double criticalWeight) {
        this.criticalWeight = criticalWeight;
    }

    public GraphAnalysisResult analyze(DecisionGraph graph) {
        double conflictLevel = graph.interconnections() > 0
            ? (double) graph.conflictCount() / graph.interconnections()
            : 0.0;
        double coherenceScore = graph.interconnections() > 0
            ? (double) graph.supportCount() / graph.interconnections()
            : 1.0;

        List<String> criticalNodes = graph.nodes().stream()
            .filter(n -> n.weight() > criticalWeight)
            .sorted(Comparator.comparingDouble(GraphNode::weight).reversed())
            .map(GraphNode::nodeId)
            .toList();

        List<ConflictingPair> conflictingPairs = findConflictingPairs(graph);
        List<String> recommendations = recommend(graph, conflictLevel, coherenceScore, criticalNodes);

        log.info("Graph analysis: conflictLevel={}, coherenceScore={}, criticalNodes={}, conflictingPairs={}",
            format(conflictLevel), format(coherenceScore), criticalNodes.size(), conflictingPairs.size());

        return new GraphAnalysisResult(graph, conflictLevel, coherenceScore,
            criticalNodes, conflictingPairs, recommendations);
    }

    private List<ConflictingPair> findConflictingPairs(DecisionGraph graph) {
        List<ConflictingPair> pairs = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (GraphNode node : graph.nodes()) {
            for (Connection conn : node.connections()) {
                if (conn.relationshipType() != RelationshipType.CONFLICTS) {
                    continue;
                }
                if (!seen.add(pairKey(node.nodeId(), conn.nodeId()))) {
                    continue;
                }
                graph.findNode(conn.nodeId()).ifPresent(other -> pairs.add(new ConflictingPair(
                    node.nodeId(), other.nodeId(), conflictReason(node.decision(), other.decision()))));
            }
        }
        return pairs;
    }

    private static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "\u0000" + b : b + "\u0000" + a;
    }

    static String conflictReason(NodeDecision first, NodeDecision second) {
        if (!first.decisionType().equals(second.decisionType())) {
            return "Conflicting decision types: " + first.decisionType() + " vs " + second.decisionType();
        }
        return "Incompatible configurations in " + first.decisionType();
    }

    private List<String> recommend(DecisionGraph graph, double conflictLevel,
                                   double coherenceScore, List<String> criticalNodes) {
        List<String> recommendations = new ArrayList<>();

        if (conflictLevel > HIGH_CONFLICT) {
            recommendations.add("High conflict level detected (" + percent(conflictLevel)
                + "). Manual review recommended before execution.");
        } else if (conflictLevel > MODERATE_CONFLICT) {
            recommendations.add("Moderate conflicts detected. Consider resolving "
                + graph.conflictCount() + " conflicting decisions.");
        }

        if (coherenceScore > HIGH_COHERENCE) {
            recommendations.add("High coherence score (" + percent(coherenceScore)
                + "). Decisions are well-aligned for execution.");
        } else if (coherenceScore < LOW_COHERENCE) {
            recommendations.add("Low coherence score (" + percent(coherenceScore)
                + "). Nodes may not be working toward common goals.");
        }

        if (!criticalNodes.isEmpty()) {
            recommendations.add(criticalNodes.size() + " critical nodes identified. Prioritize execution from: "
                + String.join(", ", criticalNodes.subList(0, Math.min(TOP_CRITICAL, criticalNodes.size()))) + ".");
        }

        if (graph.interconnections() == 0) {
            recommendations.add("No interconnections detected. Decisions are independent and can be executed in parallel.");
        }

        return recommendations;
    }

    static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
