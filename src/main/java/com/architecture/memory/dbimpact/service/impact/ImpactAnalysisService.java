package com.architecture.memory.dbimpact.service.impact;

import com.architecture.memory.dbimpact.config.AsyncConfig;
import com.architecture.memory.dbimpact.config.ImpactAnalysisSettings;
import com.architecture.memory.dbimpact.exception.DependencyFetchException;
import com.architecture.memory.dbimpact.model.impact.ChangeType;
import com.architecture.memory.dbimpact.model.impact.DependencyGraphRow;
import com.architecture.memory.dbimpact.model.impact.DependencyPath;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.ImpactAggregationResult;
import com.architecture.memory.dbimpact.model.impact.ImpactDecision;
import com.architecture.memory.dbimpact.model.impact.ImpactGraph;
import com.architecture.memory.dbimpact.model.impact.ImpactResult;
import com.architecture.memory.dbimpact.model.impact.OverallImpact;
import com.architecture.memory.dbimpact.model.impact.PathEnumerationResult;
import com.architecture.memory.dbimpact.service.impact.engine.ApprovalPolicy;
import com.architecture.memory.dbimpact.service.impact.engine.GraphBuilder;
import com.architecture.memory.dbimpact.service.impact.engine.ImpactAggregator;
import com.architecture.memory.dbimpact.service.impact.engine.ImpactVerdictBuilder;
import com.architecture.memory.dbimpact.service.impact.engine.PathEnumerator;
import com.architecture.memory.dbimpact.service.impact.engine.PathRiskEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Orchestrates one impact analysis: fetch rows, build the graph, enumerate paths,
 * score, aggregate and apply the approval policy.
 *
 * <p>Only the row fetch does I/O; it runs on the fetch executor and is awaited with a deadline.
 * Everything after it is pure in-memory computation with no shared state between requests.</p>
 */
@Service
@Slf4j
public class ImpactAnalysisService {

    private final DependencyRowSource dependencyRowSource;
    private final GraphBuilder graphBuilder;
    private final PathEnumerator pathEnumerator;
    private final PathRiskEvaluator riskEvaluator;
    private final ImpactAggregator impactAggregator;
    private final ApprovalPolicy approvalPolicy;
    private final ImpactVerdictBuilder verdictBuilder;
    private final ImpactAnalysisSettings settings;
    private final Executor fetchExecutor;

    public ImpactAnalysisService(DependencyRowSource dependencyRowSource,
                                 GraphBuilder graphBuilder,
                                 PathEnumerator pathEnumerator,
                                 PathRiskEvaluator riskEvaluator,
                                 ImpactAggregator impactAggregator,
                                 ApprovalPolicy approvalPolicy,
                                 ImpactVerdictBuilder verdictBuilder,
                                 ImpactAnalysisSettings settings,
                                 @Qualifier(AsyncConfig.DEPENDENCY_FETCH_EXECUTOR) Executor fetchExecutor) {
        this.dependencyRowSource = dependencyRowSource;
        this.graphBuilder = graphBuilder;
        this.pathEnumerator = pathEnumerator;
        this.riskEvaluator = riskEvaluator;
        this.impactAggregator = impactAggregator;
        this.approvalPolicy = approvalPolicy;
        this.verdictBuilder = verdictBuilder;
        this.settings = settings;
        this.fetchExecutor = fetchExecutor;
    }

    /**
     * Analyze the impact of changing {@code root}.
     *
     * @param projectId  project whose dependency metadata is used
     * @param root       entity proposed for change
     * @param changeType kind of change
     * @return authoritative result, including the scoring policy snapshot for audit replay
     */
    public ImpactResult analyze(String projectId, EntityRef root, ChangeType changeType) {
        log.info("Analyzing {} impact of {} in project {}", changeType, root.getStableKey(), projectId);

        Enumeration enumeration = enumerate(projectId, root);
        ImpactResult result = enumeration == null
                ? emptyResult(root, changeType)
                : score(enumeration, changeType);

        log.info("Impact analysis of {} complete: {} paths, {} entities, worst {}, approval required: {}{}",
                root.getStableKey(), result.getTotalPaths(), result.getTotalEntities(),
                result.getOverallImpact().getWorstImpactLevel(), result.getOverallImpact().isRequiresApproval(),
                result.isTruncated() ? " (truncated)" : "");
        return result;
    }

    public ImpactDecision analyzeWithVerdict(String projectId, EntityRef root, ChangeType changeType) {
        ImpactResult result = analyze(projectId, root, changeType);
        return new ImpactDecision(result, verdictBuilder.build(result));
    }

    /**
     * Scores a single enumeration under every change type. Paths are immutable, so the
     * same enumeration is re-scored without fetching or traversing again.
     */
    public Map<ChangeType, OverallImpact> compareChangeTypes(String projectId, EntityRef root) {
        log.info("Comparing change types for {} in project {}", root.getStableKey(), projectId);

        Enumeration enumeration = enumerate(projectId, root);
        Map<ChangeType, OverallImpact> outcomes = new EnumMap<>(ChangeType.class);
        for (ChangeType changeType : ChangeType.values()) {
            ImpactResult result = enumeration == null
                    ? emptyResult(root, changeType)
                    : score(enumeration, changeType);
            outcomes.put(changeType, result.getOverallImpact());
        }
        return outcomes;
    }

    public PathRiskEvaluator getRiskEvaluator() {
        return riskEvaluator;
    }

    public ApprovalPolicy getApprovalPolicy() {
        return approvalPolicy;
    }

    /**
     * @return the enumeration, or null when the root has no dependents at all
     */
    private Enumeration enumerate(String projectId, EntityRef root) {
        List<DependencyGraphRow> rows = fetchRows(projectId, root);
        if (rows.isEmpty()) {
            log.info("No dependency rows found downstream of {}", root.getStableKey());
            return null;
        }

        ImpactGraph graph = graphBuilder.build(rows);
        if (!graph.contains(root)) {
            log.warn("Dependency rows for {} do not reference it; treating as having no dependents",
                    root.getStableKey());
            return null;
        }

        // Pick up the display name from metadata when the caller only knew type and id
        EntityRef rootEntity = graph.getNode(root).getEntity();
        if (rootEntity.getName() == null && root.getName() != null) {
            rootEntity = root;
        }

        PathEnumerationResult paths = pathEnumerator.enumerate(
                graph, rootEntity, settings.getMaxDepth(), settings.getMaxPaths());
        return new Enumeration(rootEntity, paths);
    }

    private ImpactResult score(Enumeration enumeration, ChangeType changeType) {
        PathEnumerationResult paths = enumeration.paths;

        List<DependencyPath> scoredPaths = paths.getPaths().stream()
                .map(path -> riskEvaluator.evaluate(path, changeType))
                .toList();

        ImpactAggregationResult aggregation = impactAggregator.aggregate(scoredPaths);

        OverallImpact overall = approvalPolicy.apply(aggregation.getOverallImpact().toBuilder()
                .truncated(paths.isTruncated())
                .build());

        return ImpactResult.builder()
                .rootEntity(enumeration.root)
                .changeType(changeType)
                .scoringVersion(riskEvaluator.getVersion())
                .policySnapshot(riskEvaluator.getPolicySnapshot())
                .approvalPolicyVersion(approvalPolicy.getVersion())
                .totalPaths(scoredPaths.size())
                .totalEntities(aggregation.getEntityImpacts().size())
                .maxDepthReached(paths.getMaxDepthReached())
                .depthLimitReached(paths.isDepthLimitReached())
                .truncated(paths.isTruncated())
                .truncationReason(paths.getTruncationReason())
                .overallImpact(overall)
                .entityImpacts(aggregation.getEntityImpacts())
                .paths(scoredPaths)
                .build();
    }

    private ImpactResult emptyResult(EntityRef root, ChangeType changeType) {
        return ImpactResult.builder()
                .rootEntity(root)
                .changeType(changeType)
                .scoringVersion(riskEvaluator.getVersion())
                .policySnapshot(riskEvaluator.getPolicySnapshot())
                .approvalPolicyVersion(approvalPolicy.getVersion())
                .totalPaths(0)
                .totalEntities(0)
                .maxDepthReached(0)
                .depthLimitReached(false)
                .truncated(false)
                .overallImpact(approvalPolicy.apply(OverallImpact.empty()))
                .entityImpacts(List.of())
                .paths(List.of())
                .build();
    }

    private List<DependencyGraphRow> fetchRows(String projectId, EntityRef root) {
        long timeoutMs = settings.getFetchTimeout().toMillis();
        // FutureTask rather than supplyAsync so that cancel(true) interrupts the fetching thread
        FutureTask<List<DependencyGraphRow>> future = new FutureTask<>(
                () -> dependencyRowSource.fetchDownstreamDependents(projectId, root, settings.getMaxDepth()));
        fetchExecutor.execute(future);

        try {
            List<DependencyGraphRow> rows = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return rows != null ? rows : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DependencyFetchException("Timed out after " + timeoutMs + "ms fetching dependents of "
                    + root.getStableKey(), e, true);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DependencyFetchException("Interrupted while fetching dependents of "
                    + root.getStableKey(), e, false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof IllegalArgumentException) {
                throw (IllegalArgumentException) cause;
            }
            throw new DependencyFetchException("Failed to fetch dependents of " + root.getStableKey()
                    + ": " + cause.getMessage(), cause, false);
        }
    }

    private static final class Enumeration {
        private final EntityRef root;
        private final PathEnumerationResult paths;

        private Enumeration(EntityRef root, PathEnumerationResult paths) {
            this.root = root;
            this.paths = paths;
        }
    }
}
