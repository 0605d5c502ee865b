package com.architecture.memory.dbimpact.service.impact.engine;

import com.architecture.memory.dbimpact.model.impact.DependencyPath;
import com.architecture.memory.dbimpact.model.impact.DependencyType;
import com.architecture.memory.dbimpact.model.impact.EntityImpact;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.EntityType;
import com.architecture.memory.dbimpact.model.impact.ImpactResult;
import com.architecture.memory.dbimpact.model.impact.ImpactVerdict;
import com.architecture.memory.dbimpact.model.impact.RiskLevel;
import com.architecture.memory.dbimpact.model.impact.VerdictReason;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders an {@link ImpactResult} into a short, ranked verdict a reviewer can act on.
 *
 * <p>Direct (depth-1) dependents are grouped by entity type and dependency type; the
 * largest group becomes the headline. Truncation and missing dependents always surface
 * as caveats, never as a confident low risk.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImpactVerdictBuilder {

    static final String NO_DEPENDENTS_STATEMENT = "No dependent entities detected";
    static final String READ_ONLY_STATEMENT = "All detected dependencies are read-only";

    static final String LIMITATION_TRUNCATED = "Analysis was truncated at the path limit; actual impact may be higher";
    static final String LIMITATION_DEPTH_LIMIT = "Dependents beyond the maximum traversal depth were not analyzed";
    static final String LIMITATION_DEEP_CHAINS = "Deep dependency chains detected; indirect effects may exist";
    static final String LIMITATION_NO_IMPACTS = "No entity impacts found; metadata may be incomplete";

    private static final int PRIMARY_PRIORITY = 1;
    private static final int SECONDARY_PRIORITY = 2;
    private static final int READ_ONLY_PRIORITY = 3;
    private static final int DEEP_CHAIN_THRESHOLD = 3;

    private final Clock clock;

    public ImpactVerdict build(ImpactResult analysis) {
        RiskLevel risk = RiskLevel.fromImpactLevel(analysis.getOverallImpact().getWorstImpactLevel());
        List<VerdictReason> reasons = buildReasons(analysis);

        ImpactVerdict verdict = ImpactVerdict.builder()
                .risk(risk)
                .requiresApproval(analysis.getOverallImpact().isRequiresApproval())
                .summary(buildSummary(risk, reasons))
                .reasons(List.copyOf(reasons))
                .limitations(List.copyOf(detectLimitations(analysis)))
                .generatedAt(Instant.now(clock))
                .build();

        log.debug("Verdict for {}: {} ({} reasons, {} limitations)", analysis.getRootEntity().getStableKey(),
                verdict.getSummary(), verdict.getReasons().size(), verdict.getLimitations().size());
        return verdict;
    }

    // -----------------------------
    // Reasons
    // -----------------------------

    private List<VerdictReason> buildReasons(ImpactResult analysis) {
        List<VerdictReason> reasons = new ArrayList<>();
        List<DependentGroup> groups = groupDirectDependents(analysis.getEntityImpacts());

        if (groups.isEmpty()) {
            reasons.add(VerdictReason.builder()
                    .priority(PRIMARY_PRIORITY)
                    .statement(NO_DEPENDENTS_STATEMENT)
                    .implication("Either the entity is unused or dependency metadata is incomplete")
                    .evidence(List.of())
                    .build());
            return reasons;
        }

        String rootNoun = analysis.getRootEntity().getType().getNoun();
        for (int i = 0; i < groups.size(); i++) {
            DependentGroup group = groups.get(i);
            reasons.add(VerdictReason.builder()
                    .priority(i == 0 ? PRIMARY_PRIORITY : SECONDARY_PRIORITY)
                    .statement(buildGroupedStatement(group, rootNoun))
                    .implication(buildGroupedImplication(group.getKey()))
                    .evidence(group.evidence())
                    .build());
        }

        if (allReadOnly(analysis.getPaths())) {
            reasons.add(VerdictReason.builder()
                    .priority(READ_ONLY_PRIORITY)
                    .statement(READ_ONLY_STATEMENT)
                    .implication("Lower risk of data corruption")
                    .evidence(List.of())
                    .build());
        }

        return reasons;
    }

    /**
     * Groups depth-1 paths by (entity type, dominant dependency type), ranked by
     * entity count, then dependency severity, then entity type.
     */
    List<DependentGroup> groupDirectDependents(List<EntityImpact> entityImpacts) {
        Map<GroupKey, DependentGroup> groups = new LinkedHashMap<>();
        for (EntityImpact impact : entityImpacts) {
            for (DependencyPath path : impact.getPaths()) {
                if (path.getDepth() != 1) {
                    continue;
                }
                GroupKey key = new GroupKey(impact.getEntity().getType(), path.getDominantDependencyType());
                groups.computeIfAbsent(key, DependentGroup::new).add(impact.getEntity());
            }
        }

        List<DependentGroup> ranked = new ArrayList<>(groups.values());
        ranked.sort(Comparator.comparingInt(DependentGroup::getCount).reversed()
                .thenComparing(g -> g.getKey().getDependencyType().getSeverity(), Comparator.reverseOrder())
                .thenComparing(g -> g.getKey().getEntityType()));
        return ranked;
    }

    private String buildGroupedStatement(DependentGroup group, String rootNoun) {
        String plural = group.getCount() == 1 ? "" : "s";
        return group.getCount() + " " + group.getKey().getEntityType().getNoun() + plural + " "
                + verbFor(group.getKey().getDependencyType()) + " this " + rootNoun;
    }

    private String buildGroupedImplication(GroupKey key) {
        DependencyType type = key.getDependencyType();
        if (type == DependencyType.UPDATE || type == DependencyType.DELETE) {
            return "IMPORTANT: Data modification logic will be affected; coordinate testing of these dependents";
        }
        if (key.getEntityType() == EntityType.STORED_PROCEDURE) {
            return "Coordinate testing across these procedures";
        }
        return "Review dependent components during testing";
    }

    static String verbFor(DependencyType type) {
        return switch (type) {
            case SELECT -> "read from";
            case INSERT -> "insert into";
            case UPDATE -> "update";
            case DELETE -> "delete from";
            default -> "depend on";
        };
    }

    private boolean allReadOnly(List<DependencyPath> paths) {
        if (paths == null || paths.isEmpty()) {
            return false;
        }
        return paths.stream()
                .flatMap(p -> p.getEdges().stream())
                .allMatch(e -> e == DependencyType.SELECT);
    }

    // -----------------------------
    // Summary and limitations
    // -----------------------------

    private String buildSummary(RiskLevel risk, List<VerdictReason> reasons) {
        if (reasons.isEmpty()) {
            return "No significant impact detected";
        }
        return risk.getLabel() + " risk – " + reasons.get(0).getStatement();
    }

    private List<String> detectLimitations(ImpactResult analysis) {
        List<String> limits = new ArrayList<>();

        if (analysis.isTruncated()) {
            limits.add(LIMITATION_TRUNCATED);
        }
        if (analysis.isDepthLimitReached()) {
            limits.add(LIMITATION_DEPTH_LIMIT);
        }
        if (analysis.getMaxDepthReached() > DEEP_CHAIN_THRESHOLD) {
            limits.add(LIMITATION_DEEP_CHAINS);
        }
        if (analysis.getEntityImpacts() == null || analysis.getEntityImpacts().isEmpty()) {
            limits.add(LIMITATION_NO_IMPACTS);
        }
        return limits;
    }

    @Value
    static class GroupKey {
        EntityType entityType;
        DependencyType dependencyType;
    }

    /**
     * Direct dependents sharing one {@link GroupKey}.
     */
    static class DependentGroup {
        private final GroupKey key;
        private final Set<EntityRef> entities = new LinkedHashSet<>();

        DependentGroup(GroupKey key) {
            this.key = key;
        }

        void add(EntityRef entity) {
            entities.add(entity);
        }

        GroupKey getKey() {
            return key;
        }

        int getCount() {
            return entities.size();
        }

        List<String> evidence() {
            return entities.stream().map(EntityRef::getStableKey).toList();
        }
    }
}
