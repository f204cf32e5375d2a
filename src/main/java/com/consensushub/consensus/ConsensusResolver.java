package com.consensushub.consensus;

import com.consensushub.contract.ConsensusMethod;
import com.consensushub.contract.DecisionStatus;
import com.consensushub.contract.NodeDecision;
import com.consensushub.graph.GraphAnalysisResult;
import com.consensushub.graph.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a graph analysis into a single consensus outcome under one voting rule.
 *
 * Votes are derived, not cast: confidence below 0.3 abstains, confidence
 * below 0.5 in a round whose conflict level exceeds 0.5 rejects, everything
 * else approves. The resolver never produces REJECTED; a round without
 * consensus is sent for review.
 */
public class ConsensusResolver {

    private static final Logger log = LoggerFactory.getLogger(ConsensusResolver.class);

    static final double ABSTAIN_BELOW = 0.3;
    static final double REJECT_BELOW = 0.5;
    static final double REJECT_CONFLICT_ABOVE = 0.5;

    private final ConsensusProperties properties;

    public ConsensusResolver(ConsensusProperties properties) {
        this.properties = properties;
    }

    public ConsensusResult resolve(GraphAnalysisResult analysis) {
        return resolve(analysis, ConsensusMethod.WEIGHTED_VOTE);
    }

    public ConsensusResult resolve(GraphAnalysisResult analysis, ConsensusMethod method) {
        ConsensusMethod effective = ConsensusMethod.orDefault(method);
        List<NodeDecision> decisions = analysis.graph().nodes().stream()
            .map(GraphNode::decision)
            .toList();
        double conflictLevel = analysis.conflictLevel();

        Map<String, VotingResult> votes = castVotes(decisions, conflictLevel);
        double agreementRatio = agreementRatio(votes.values(), effective);
        boolean consensusReached = consensusReached(agreementRatio, effective);

        Map<String, Object> finalDecision = FinalDecisionMerger.merge(decisions, votes);
        double finalConfidence = finalConfidence(decisions, agreementRatio, analysis.coherenceScore());
        String checksum = DecisionChecksum.of(finalDecision);

        DecisionStatus status;
        String reviewReason = null;
        if (consensusReached && conflictLevel < properties.getConflictCeiling()) {
            status = DecisionStatus.APPROVED;
        } else if (consensusReached) {
            status = DecisionStatus.REVIEW_REQUIRED;
            reviewReason = "High conflict level (" + percent(conflictLevel) + ") requires manual review";
        } else {
            status = DecisionStatus.REVIEW_REQUIRED;
            reviewReason = "Agreement ratio (" + percent(agreementRatio) + ") below threshold ("
                + percent(effective == ConsensusMethod.UNANIMOUS ? 1.0 : properties.getApprovalThreshold()) + ")";
        }

        log.info("Consensus resolved: method={}, agreementRatio={}, status={}, finalConfidence={}",
            effective.getValue(), percent(agreementRatio), status.getValue(),
            String.format(Locale.ROOT, "%.2f", finalConfidence));

        return new ConsensusResult(consensusReached, agreementRatio, effective, finalDecision,
            finalConfidence, checksum, votes, status, reviewReason, Instant.now());
    }

    Map<String, VotingResult> castVotes(List<NodeDecision> decisions, double conflictLevel) {
        Map<String, VotingResult> votes = new LinkedHashMap<>();
        for (NodeDecision decision : decisions) {
            double confidence = decision.confidence();

            Vote vote = Vote.APPROVE;
            if (confidence < ABSTAIN_BELOW) {
                vote = Vote.ABSTAIN;
            } else if (confidence < REJECT_BELOW && conflictLevel > REJECT_CONFLICT_ABOVE) {
                vote = Vote.REJECT;
            }

            double weight = confidence;
            if (properties.isWeightByConfidence()) {
                weight *= confidence;
            }
            if (properties.isWeightByImpact()) {
                weight *= decision.expectedImpact();
            }

            votes.put(decision.nodeId(), new VotingResult(vote, weight));
        }
        return votes;
    }

    double agreementRatio(Collection<VotingResult> votes, ConsensusMethod method) {
        if (votes.isEmpty()) {
            return 0.0;
        }

        long approveCount = votes.stream().filter(VotingResult::approves).count();

        return switch (method) {
            case WEIGHTED_VOTE -> {
                double totalWeight = votes.stream().mapToDouble(VotingResult::weight).sum();
                double approveWeight = votes.stream()
                    .filter(VotingResult::approves)
                    .mapToDouble(VotingResult::weight)
                    .sum();
                yield totalWeight > 0 ? approveWeight / totalWeight : 0.0;
            }
            case UNANIMOUS -> approveCount == votes.size() ? 1.0 : 0.0;
            case MAJORITY -> (double) approveCount / votes.size();
            case QUORUM -> {
                long participating = votes.stream().filter(VotingResult::participates).count();
                double participation = (double) participating / votes.size();
                if (participating == 0 || participation < properties.getQuorumPercentage()) {
                    yield 0.0;
                }
                yield (double) approveCount / participating;
            }
        };
    }

    boolean consensusReached(double agreementRatio, ConsensusMethod method) {
        if (method == ConsensusMethod.UNANIMOUS) {
            return agreementRatio == 1.0;
        }
        return agreementRatio >= properties.getApprovalThreshold();
    }

    static double finalConfidence(List<NodeDecision> decisions, double agreementRatio, double coherenceScore) {
        if (decisions.isEmpty()) {
            return 0.0;
        }
        double avgConfidence = decisions.stream()
            .mapToDouble(NodeDecision::confidence)
            .average()
            .orElse(0.0);
        return (avgConfidence * 0.4) + (agreementRatio * 0.4) + (coherenceScore * 0.2);
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }
}
