package com.architecture.memory.dbimpact.service.impact.engine;

import com.architecture.memory.dbimpact.model.impact.DependencyPath;
import com.architecture.memory.dbimpact.model.impact.DependencyType;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.EntityType;
import com.architecture.memory.dbimpact.model.impact.ImpactGraph;
import com.architecture.memory.dbimpact.model.impact.PathEnumerationResult;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static com.architecture.memory.dbimpact.service.impact.engine.ImpactTestRows.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BfsPathEnumeratorTest {

    private final GraphBuilder graphBuilder = new GraphBuilder();
    private final BfsPathEnumerator enumerator = new BfsPathEnumerator();

    private static final EntityRef TABLE_1 = EntityRef.of(EntityType.TABLE, 1);

    @Test
    void emitsIntermediateAndLeafPathsBreadthFirst() {
        // Table:1 <- View:2 <- SP:3
        ImpactGraph graph = graphBuilder.build(List.of(
                row("VIEW", 2, "TABLE", 1, "SELECT"),
                row("SP", 3, "VIEW", 2, "UPDATE")));

        PathEnumerationResult result = enumerator.enumerate(graph, TABLE_1, 10, 100);

        assertThat(result.getPaths()).extracting(DependencyPath::getPathId)
                .containsExactly("Table:1->View:2", "Table:1->View:2->StoredProcedure:3");
        assertThat(result.getMaxDepthReached()).isEqualTo(2);
        assertThat(result.isTruncated()).isFalse();
        assertThat(result.isDepthLimitReached()).isFalse();

        DependencyPath deep = result.getPaths().get(1);
        assertThat(deep.getDepth()).isEqualTo(2);
        assertThat(deep.getEdges()).containsExactly(DependencyType.SELECT, DependencyType.UPDATE);
        assertThat(deep.getMaxDependencyType()).isEqualTo(DependencyType.UPDATE);
        assertThat(deep.isScored()).isFalse();
    }

    @Test
    void rootWithoutDependentsYieldsNoPaths() {
        ImpactGraph graph = graphBuilder.build(List.of(row("VIEW", 2, "TABLE", 1, "SELECT")));

        PathEnumerationResult result = enumerator.enumerate(graph, EntityRef.of(EntityType.VIEW, 2), 10, 100);

        assertThat(result.getPaths()).isEmpty();
        assertThat(result.isTruncated()).isFalse();
        assertThat(result.getMaxDepthReached()).isZero();
    }

    @Test
    void cyclesTerminateAndNoPathRepeatsAnEntity() {
        ImpactGraph graph = graphBuilder.build(List.of(
                row("VIEW", 2, "TABLE", 1, "SELECT"),
                row("SP", 3, "VIEW", 2, "SELECT"),
                row("TABLE", 1, "SP", 3, "INSERT")));

        PathEnumerationResult result = enumerator.enumerate(graph, TABLE_1, 10, 100);

        assertThat(result.getPaths()).hasSize(2);
        for (DependencyPath path : result.getPaths()) {
            assertThat(new HashSet<>(path.getNodes())).hasSameSizeAs(path.getNodes());
        }
    }

    @Test
    void convergingBranchesAreKeptAsSeparatePaths() {
        // Table:1 <- View:2 <- SP:4 and Table:1 <- View:3 <- SP:4
        ImpactGraph graph = graphBuilder.build(List.of(
                row("VIEW", 2, "TABLE", 1, "SELECT"),
                row("VIEW", 3, "TABLE", 1, "SELECT"),
                row("SP", 4, "VIEW", 2, "SELECT"),
                row("SP", 4, "VIEW", 3, "DELETE")));

        PathEnumerationResult result = enumerator.enumerate(graph, TABLE_1, 10, 100);

        assertThat(result.getPaths()).extracting(DependencyPath::getPathId).containsExactly(
                "Table:1->View:2",
                "Table:1->View:3",
                "Table:1->View:2->StoredProcedure:4",
                "Table:1->View:3->StoredProcedure:4");
    }

    @Test
    void stopsAtMaxDepthAndReportsUnvisitedDependents() {
        ImpactGraph graph = graphBuilder.build(List.of(
                row("VIEW", 2, "TABLE", 1, "SELECT"),
                row("SP", 3, "VIEW", 2, "SELECT"),
                row("FUNCTION", 4, "SP", 3, "SELECT")));

        PathEnumerationResult result = enumerator.enumerate(graph, TABLE_1, 2, 100);

        assertThat(result.getPaths()).hasSize(2);
        assertThat(result.getPaths()).allMatch(p -> p.getDepth() <= 2);
        assertThat(result.getMaxDepthReached()).isEqualTo(2);
        assertThat(result.isDepthLimitReached()).isTrue();
        assertThat(result.isTruncated()).isFalse();
    }

    @Test
    void truncatesOnlyWhenAnotherCandidateExists() {
        ImpactGraph graph = graphBuilder.build(List.of(
                row("VIEW", 2, "TABLE", 1, "SELECT"),
                row("VIEW", 3, "TABLE", 1, "SELECT"),
                row("VIEW", 4, "TABLE", 1, "SELECT")));

        PathEnumerationResult exact = enumerator.enumerate(graph, TABLE_1, 10, 3);
        PathEnumerationResult limited = enumerator.enumerate(graph, TABLE_1, 10, 2);

        assertThat(exact.getPaths()).hasSize(3);
        assertThat(exact.isTruncated()).isFalse();
        assertThat(exact.getTruncationReason()).isNull();

        assertThat(limited.getPaths()).hasSize(2);
        assertThat(limited.isTruncated()).isTrue();
        assertThat(limited.getTruncationReason()).isEqualTo(PathEnumerationResult.PATH_LIMIT);
    }

    @Test
    void maxCriticalityIncludesTheRoot() {
        ImpactGraph graph = graphBuilder.build(List.of(row("VIEW", 2, 1, "TABLE", 1, 5, "SELECT")));

        PathEnumerationResult result = enumerator.enumerate(graph, TABLE_1, 10, 100);

        assertThat(result.getPaths().get(0).getMaxCriticalityLevel()).isEqualTo(5);
    }

    @Test
    void rejectsNonPositiveLimits() {
        ImpactGraph graph = graphBuilder.build(List.of(row("VIEW", 2, "TABLE", 1, "SELECT")));

        assertThatThrownBy(() -> enumerator.enumerate(graph, TABLE_1, 0, 100))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> enumerator.enumerate(graph, TABLE_1, 10, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rootMissingFromGraphIsAnError() {
        assertThatThrownBy(() -> enumerator.enumerate(ImpactGraph.empty(), TABLE_1, 10, 100))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Table:1");
    }
}
