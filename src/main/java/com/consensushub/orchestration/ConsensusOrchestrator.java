package com.consensushub.orchestration;

import com.consensushub.api.ConsensusNotFoundException;
import com.consensushub.consensus.ConsensusResolver;
import com.consensushub.consensus.ConsensusResult;
import com.consensushub.contract.ConsensusMethod;
import com.consensushub.contract.DecisionStatus;
import com.consensushub.contract.NodeDecision;
import com.consensushub.contract.OrchestrationRequest;
import com.consensushub.contract.OrchestrationRequestValidator;
import com.consensushub.contract.ValidationException;
import com.consensushub.governance.GovernanceGate;
import com.consensushub.governance.GovernanceUnavailableException;
import com.consensushub.governance.GovernanceVerdict;
import com.consensushub.graph.DecisionGraph;
import com.consensushub.graph.DecisionGraphBuilder;
import com.consensushub.graph.GraphAnalysisResult;
import com.consensushub.graph.GraphAnalyzer;
import com.consensushub.store.ConsensusRecord;
import com.consensushub.store.ConsensusStatistics;
import com.consensushub.store.ConsensusStore;
import com.consensushub.store.IllegalTransitionException;
import com.consensushub.store.PersistenceException;
import com.consensushub.store.StatusUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Runs one consensus round end to end:
 * validating, graph-building, analyzing, resolving, governance-check, persisted.
 *
 * A round is synchronous and request-scoped. The only calls that leave the
 * process are the governance gate and the store write; a failure in either,
 * or in validation, aborts the round and nothing is stored. Rounds share no
 * mutable state besides the store.
 *
 * Governance can upgrade REVIEW_REQUIRED to APPROVED and downgrade APPROVED
 * to REVIEW_REQUIRED. It never produces REJECTED.
 */
@Service
public class ConsensusOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConsensusOrchestrator.class);

    static final int MAX_RECENT = 100;

    private final OrchestrationRequestValidator validator;
    private final DecisionGraphBuilder graphBuilder;
    private final GraphAnalyzer graphAnalyzer;
    private final ConsensusResolver resolver;
    private final GovernanceGate governanceGate;
    private final ConsensusStore store;
    private final OrchestrationProperties properties;
    private final List<OrchestrationObserver> observers;

    public ConsensusOrchestrator(OrchestrationRequestValidator validator,
                                 DecisionGraphBuilder graphBuilder,
                                 GraphAnalyzer graphAnalyzer,
                                 ConsensusResolver resolver,
                                 GovernanceGate governanceGate,
                                 ConsensusStore store,
                                 OrchestrationProperties properties,
                                 List<OrchestrationObserver> observers) {
        this.validator = validator;
        this.graphBuilder = graphBuilder;
        this.graphAnalyzer = graphAnalyzer;
        this.resolver = resolver;
        this.governanceGate = governanceGate;
        this.store = store;
        this.properties = properties;
        this.observers = List.copyOf(observers);
    }

    public OrchestrationResult orchestrate(OrchestrationRequest request) {
        String consensusId = generateConsensusId();
        OrchestrationStage stage = OrchestrationStage.VALIDATING;
        try {
            enter(consensusId, stage);
            validator.validate(request, properties.getMinNodes());
            List<NodeDecision> decisions = request.nodeDecisions();
            ConsensusMethod method = request.effectiveMethod();

            log.info("Starting round {}: initiator={}, decisionType={}, nodes={}, method={}",
                consensusId, request.initiatorNode(), request.decisionType(), decisions.size(), method.getValue());

            stage = OrchestrationStage.GRAPH_BUILDING;
            enter(consensusId, stage);
            DecisionGraph graph = graphBuilder.build(decisions);

            stage = OrchestrationStage.ANALYZING;
            enter(consensusId, stage);
            GraphAnalysisResult analysis = graphAnalyzer.analyze(graph);

            stage = OrchestrationStage.RESOLVING;
            enter(consensusId, stage);
            ConsensusResult consensus = resolver.resolve(analysis, method);

            stage = OrchestrationStage.GOVERNANCE_CHECK;
            enter(consensusId, stage);
            List<String> participatingNodes = decisions.stream().map(NodeDecision::nodeId).toList();
            GovernanceOutcome governance = checkGovernance(consensusId, request, analysis, consensus, participatingNodes);

            DecisionStatus finalStatus = reconcile(consensus.status(), governance.approved());
            String reviewReason = finalStatus == DecisionStatus.APPROVED
                ? null
                : firstNonNull(governance.reason(), consensus.reviewReason());

            OrchestrationResult result = new OrchestrationResult(
                consensusId,
                finalStatus,
                consensus.consensusReached(),
                consensus.consensusMethod(),
                consensus.agreementRatio(),
                consensus.finalDecision(),
                consensus.finalConfidence(),
                consensus.checksum(),
                consensus.votingResults(),
                participatingNodes,
                analysis.conflictLevel(),
                analysis.coherenceScore(),
                governance.approved(),
                reviewReason,
                analysis.recommendations(),
                Instant.now()
            );

            stage = OrchestrationStage.PERSISTED;
            persist(new ConsensusRecord(result, request.decisionType(), request.initiatorNode(), decisions, graph));
            enter(consensusId, stage);

            notifyCompleted(result);
            return result;
        } catch (RuntimeException ex) {
            notifyFailed(consensusId, stage, ex);
            throw ex;
        }
    }

    public Optional<ConsensusRecord> getConsensus(String consensusId) {
        return store.get(consensusId);
    }

    public List<ConsensusRecord> listRecent(int limit) {
        return store.listRecent(Math.max(1, Math.min(limit, MAX_RECENT)));
    }

    public ConsensusStatistics getStatistics() {
        return store.aggregateStatistics();
    }

    /**
     * Records an execution or broadcast outcome. The consensus numbers of the
     * round are never touched.
     *
     * @throws ConsensusNotFoundException if no round has this id
     * @throws IllegalTransitionException if the status change is not allowed
     */
    public ConsensusRecord updateConsensusStatus(String consensusId, StatusUpdate update) {
        if (update == null || update.isEmpty()) {
            throw new ValidationException("status update must change at least one field");
        }
        ConsensusRecord updated = store.updateStatus(consensusId, update)
            .orElseThrow(() -> new ConsensusNotFoundException(consensusId));
        log.info("Consensus {} updated: status={}, broadcastStatus={}",
            consensusId, updated.getStatus().getValue(), updated.getBroadcastStatus().getValue());
        return updated;
    }

    private GovernanceOutcome checkGovernance(String consensusId, OrchestrationRequest request,
                                              GraphAnalysisResult analysis, ConsensusResult consensus,
                                              List<String> participatingNodes) {
        boolean required = request.governanceRequested()
            || analysis.conflictLevel() >= properties.getGovernanceConflictThreshold()
            || consensus.status() == DecisionStatus.REVIEW_REQUIRED;

        if (!required) {
            boolean approved = consensus.agreementRatio() >= properties.getAutoApproveThreshold()
                && analysis.conflictLevel() < properties.getAutoApproveConflictCeiling();
            log.info("Round {} governance: auto-{}", consensusId, approved ? "approved" : "review required");
            return new GovernanceOutcome(approved, approved ? null
                : "Agreement ratio (" + percent(consensus.agreementRatio())
                    + ") below auto-approval threshold (" + percent(properties.getAutoApproveThreshold()) + ")");
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("consensusId", consensusId);
        context.put("agreementRatio", consensus.agreementRatio());
        context.put("conflictLevel", analysis.conflictLevel());
        context.put("participatingNodes", participatingNodes);

        GovernanceVerdict verdict;
        try {
            verdict = governanceGate.submitDecision(
                request.initiatorNode(), "orchestrate_" + request.decisionType(), context);
        } catch (RuntimeException ex) {
            throw new GovernanceUnavailableException("Governance gate failed for round " + consensusId, ex);
        }
        if (verdict == null || verdict.status() == null) {
            throw new GovernanceUnavailableException("Governance gate returned no verdict for round " + consensusId, null);
        }

        boolean approved = verdict.isApproved();
        log.info("Round {} governance: {} ({})", consensusId, verdict.status(), verdict.reason());
        return new GovernanceOutcome(approved,
            approved ? null : firstNonNull(verdict.reason(), "Governance approval required"));
    }

    static DecisionStatus reconcile(DecisionStatus consensusStatus, boolean governanceApproved) {
        if (governanceApproved && consensusStatus == DecisionStatus.REVIEW_REQUIRED) {
            return DecisionStatus.APPROVED;
        }
        if (!governanceApproved && consensusStatus == DecisionStatus.APPROVED) {
            return DecisionStatus.REVIEW_REQUIRED;
        }
        return consensusStatus;
    }

    private void persist(ConsensusRecord record) {
        try {
            store.store(record);
        } catch (PersistenceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new PersistenceException("Failed to store round " + record.getConsensusId(), ex);
        }
    }

    private static String generateConsensusId() {
        return "consensus-" + System.currentTimeMillis() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private void enter(String consensusId, OrchestrationStage stage) {
        notifyObservers(observer -> observer.onStageEntered(consensusId, stage), consensusId);
    }

    private void notifyCompleted(OrchestrationResult result) {
        notifyObservers(observer -> observer.onRoundCompleted(result), result.consensusId());
    }

    private void notifyFailed(String consensusId, OrchestrationStage stage, RuntimeException error) {
        notifyObservers(observer -> observer.onRoundFailed(consensusId, stage, error), consensusId);
    }

    private void notifyObservers(Consumer<OrchestrationObserver> call, String consensusId) {
        observers.forEach(observer -> {
            try {
                call.accept(observer);
            } catch (Exception ex) {
                log.warn("Observer notification failed for round={}: {}", consensusId, ex.getMessage());
            }
        });
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }

    private record GovernanceOutcome(boolean approved, String reason) {}
}
