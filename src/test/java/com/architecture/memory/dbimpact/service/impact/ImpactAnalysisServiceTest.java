package com.architecture.memory.dbimpact.service.impact;

import com.architecture.memory.dbimpact.config.ImpactAnalysisSettings;
import com.architecture.memory.dbimpact.exception.DependencyFetchException;
import com.architecture.memory.dbimpact.model.impact.ChangeType;
import com.architecture.memory.dbimpact.model.impact.DependencyGraphRow;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.EntityType;
import com.architecture.memory.dbimpact.model.impact.ImpactDecision;
import com.architecture.memory.dbimpact.model.impact.ImpactLevel;
import com.architecture.memory.dbimpact.model.impact.ImpactResult;
import com.architecture.memory.dbimpact.model.impact.OverallImpact;
import com.architecture.memory.dbimpact.model.impact.RiskLevel;
import com.architecture.memory.dbimpact.service.impact.engine.ApprovalPolicyV1;
import com.architecture.memory.dbimpact.service.impact.engine.BfsPathEnumerator;
import com.architecture.memory.dbimpact.service.impact.engine.GraphBuilder;
import com.architecture.memory.dbimpact.service.impact.engine.ImpactAggregator;
import com.architecture.memory.dbimpact.service.impact.engine.ImpactVerdictBuilder;
import com.architecture.memory.dbimpact.service.impact.engine.PathRiskEvaluatorV1;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImpactAnalysisServiceTest {

    private static final String PROJECT_ID = "project-1";
    private static final EntityRef TABLE_1 = EntityRef.of(EntityType.TABLE, 1);

    @Mock
    private DependencyRowSource dependencyRowSource;

    @Test
    void scoresAggregatesAndAppliesApprovalPolicy() {
        when(dependencyRowSource.fetchDownstreamDependents(PROJECT_ID, TABLE_1, 10)).thenReturn(List.of(
                row("SP", 10, "SELECT"),
                row("VIEW", 20, "DELETE")));

        ImpactResult result = service(Runnable::run, 1000).analyze(PROJECT_ID, TABLE_1, ChangeType.DELETE);

        assertThat(result.getTotalPaths()).isEqualTo(2);
        assertThat(result.getTotalEntities()).isEqualTo(2);
        assertThat(result.getPaths()).allMatch(p -> p.isScored());
        // 10 x 3 x 3 x 1.0 = 90
        assertThat(result.getOverallImpact().getWorstImpactLevel()).isEqualTo(ImpactLevel.CRITICAL);
        assertThat(result.getOverallImpact().getWorstRiskScore()).isEqualTo(90);
        assertThat(result.getOverallImpact().getTriggeringEntity()).isEqualTo(EntityRef.of(EntityType.VIEW, 20));
        assertThat(result.getOverallImpact().isRequiresApproval()).isTrue();
        assertThat(result.getScoringVersion()).isEqualTo(PathRiskEvaluatorV1.VERSION);
        assertThat(result.getApprovalPolicyVersion()).isEqualTo(ApprovalPolicyV1.VERSION);
        assertThat(result.getPolicySnapshot()).isNotNull();
        assertThat(result.isTruncated()).isFalse();
    }

    @Test
    void rootPicksUpItsNameFromMetadata() {
        when(dependencyRowSource.fetchDownstreamDependents(any(), any(), anyInt())).thenReturn(List.of(
                DependencyGraphRow.builder()
                        .sourceEntityType("SP").sourceEntityId(10)
                        .targetEntityType("TABLE").targetEntityId(1).targetEntityName("Orders")
                        .dependencyType("SELECT")
                        .depth(1)
                        .build()));

        ImpactResult result = service(Runnable::run, 1000).analyze(PROJECT_ID, TABLE_1, ChangeType.MODIFY);

        assertThat(result.getRootEntity().getName()).isEqualTo("Orders");
        assertThat(result.getRootEntity()).isEqualTo(TABLE_1);
    }

    @Test
    void noRowsTakesTheFastPath() {
        when(dependencyRowSource.fetchDownstreamDependents(any(), any(), anyInt())).thenReturn(List.of());

        ImpactResult result = service(Runnable::run, 1000).analyze(PROJECT_ID, TABLE_1, ChangeType.DELETE);

        assertThat(result.getTotalPaths()).isZero();
        assertThat(result.getEntityImpacts()).isEmpty();
        assertThat(result.getPaths()).isEmpty();
        assertThat(result.getOverallImpact().getWorstImpactLevel()).isEqualTo(ImpactLevel.NONE);
        assertThat(result.getOverallImpact().isRequiresApproval()).isFalse();
        assertThat(result.isTruncated()).isFalse();
        assertThat(result.getPolicySnapshot()).isNotNull();
    }

    @Test
    void truncationForcesApproval() {
        when(dependencyRowSource.fetchDownstreamDependents(any(), any(), anyInt())).thenReturn(List.of(
                row("VIEW", 2, "SELECT"),
                row("VIEW", 3, "SELECT"),
                row("VIEW", 4, "SELECT")));

        ImpactResult result = service(Runnable::run, 2).analyze(PROJECT_ID, TABLE_1, ChangeType.CREATE);

        assertThat(result.isTruncated()).isTrue();
        assertThat(result.getTotalPaths()).isEqualTo(2);
        assertThat(result.getOverallImpact().getWorstImpactLevel()).isEqualTo(ImpactLevel.LOW);
        assertThat(result.getOverallImpact().isTruncated()).isTrue();
        assertThat(result.getOverallImpact().isRequiresApproval()).isTrue();
    }

    @Test
    void analyzeWithVerdictRendersTheSameResult() {
        when(dependencyRowSource.fetchDownstreamDependents(any(), any(), anyInt())).thenReturn(List.of(
                row("SP", 10, "SELECT")));

        ImpactDecision decision = service(Runnable::run, 1000).analyzeWithVerdict(PROJECT_ID, TABLE_1, ChangeType.MODIFY);

        assertThat(decision.getVerdict().getRisk()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(decision.getVerdict().isRequiresApproval())
                .isEqualTo(decision.getResult().getOverallImpact().isRequiresApproval());
    }

    @Test
    void comparesChangeTypesFromASingleFetch() {
        when(dependencyRowSource.fetchDownstreamDependents(PROJECT_ID, TABLE_1, 10)).thenReturn(List.of(
                row("SP", 10, "SELECT")));

        Map<ChangeType, OverallImpact> outcomes = service(Runnable::run, 1000).compareChangeTypes(PROJECT_ID, TABLE_1);

        // 4 x multiplier x 3 x 1.0
        assertThat(outcomes.get(ChangeType.CREATE).getWorstRiskScore()).isEqualTo(12);
        assertThat(outcomes.get(ChangeType.MODIFY).getWorstRiskScore()).isEqualTo(24);
        assertThat(outcomes.get(ChangeType.DELETE).getWorstRiskScore()).isEqualTo(36);
        assertThat(outcomes.get(ChangeType.CREATE).isRequiresApproval()).isFalse();
        assertThat(outcomes.get(ChangeType.DELETE).isRequiresApproval()).isTrue();
        verify(dependencyRowSource, times(1)).fetchDownstreamDependents(eq(PROJECT_ID), eq(TABLE_1), anyInt());
    }

    @Test
    void fetchThatMissesTheDeadlineTimesOut() {
        Executor neverRuns = task -> { };

        ImpactAnalysisService service = service(neverRuns, 1000, Duration.ofMillis(50));

        assertThatThrownBy(() -> service.analyze(PROJECT_ID, TABLE_1, ChangeType.MODIFY))
                .isInstanceOf(DependencyFetchException.class)
                .satisfies(e -> assertThat(((DependencyFetchException) e).isTimedOut()).isTrue());
    }

    @Test
    void timedOutFetchIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        when(dependencyRowSource.fetchDownstreamDependents(any(), any(), anyInt())).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return List.of();
        });
        Executor ownThread = task -> new Thread(task).start();

        ImpactAnalysisService service = service(ownThread, 1000, Duration.ofMillis(50));

        assertThatThrownBy(() -> service.analyze(PROJECT_ID, TABLE_1, ChangeType.MODIFY))
                .isInstanceOf(DependencyFetchException.class);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void fetchFailureIsWrapped() {
        when(dependencyRowSource.fetchDownstreamDependents(any(), any(), anyInt()))
                .thenThrow(new IllegalStateException("connection refused"));

        assertThatThrownBy(() -> service(Runnable::run, 1000).analyze(PROJECT_ID, TABLE_1, ChangeType.MODIFY))
                .isInstanceOf(DependencyFetchException.class)
                .hasMessageContaining("connection refused")
                .satisfies(e -> assertThat(((DependencyFetchException) e).isTimedOut()).isFalse());
    }

    private ImpactAnalysisService service(Executor executor, int maxPaths) {
        return service(executor, maxPaths, Duration.ofSeconds(5));
    }

    private ImpactAnalysisService service(Executor executor, int maxPaths, Duration fetchTimeout) {
        return new ImpactAnalysisService(
                dependencyRowSource,
                new GraphBuilder(),
                new BfsPathEnumerator(),
                new PathRiskEvaluatorV1(),
                new ImpactAggregator(),
                new ApprovalPolicyV1(),
                new ImpactVerdictBuilder(Clock.systemUTC()),
                new ImpactAnalysisSettings(10, maxPaths, fetchTimeout),
                executor);
    }

    private static DependencyGraphRow row(String sourceType, long sourceId, String dependencyType) {
        return DependencyGraphRow.builder()
                .sourceEntityType(sourceType)
                .sourceEntityId(sourceId)
                .targetEntityType("TABLE")
                .targetEntityId(1)
                .dependencyType(dependencyType)
                .depth(1)
                .build();
    }
}
