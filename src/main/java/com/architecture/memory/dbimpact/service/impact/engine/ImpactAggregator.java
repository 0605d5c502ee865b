package com.architecture.memory.dbimpact.service.impact.engine;

import com.architecture.memory.dbimpact.model.impact.DependencyPath;
import com.architecture.memory.dbimpact.model.impact.EntityImpact;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.ImpactAggregationResult;
import com.architecture.memory.dbimpact.model.impact.ImpactLevel;
import com.architecture.memory.dbimpact.model.impact.OverallImpact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates scored paths into entity-level and overall impact.
 * Paths converging on one entity are reported once, under that entity's worst case.
 * The approval decision is not made here.
 */
@Component
@Slf4j
public class ImpactAggregator {

    public ImpactAggregationResult aggregate(List<DependencyPath> scoredPaths) {
        if (scoredPaths == null || scoredPaths.isEmpty()) {
            return new ImpactAggregationResult(List.of(), OverallImpact.empty());
        }

        // Group by terminal entity, keeping first-seen order
        Map<EntityRef, List<DependencyPath>> byEntity = new LinkedHashMap<>();
        for (DependencyPath path : scoredPaths) {
            if (path.getNodes() == null || path.getNodes().isEmpty()) {
                continue;
            }
            byEntity.computeIfAbsent(path.getTerminalEntity(), k -> new ArrayList<>()).add(path);
        }

        List<EntityImpact> entityImpacts = new ArrayList<>(byEntity.size());
        for (Map.Entry<EntityRef, List<DependencyPath>> entry : byEntity.entrySet()) {
            entityImpacts.add(toEntityImpact(entry.getKey(), entry.getValue()));
        }

        if (entityImpacts.isEmpty()) {
            return new ImpactAggregationResult(List.of(), OverallImpact.empty());
        }

        EntityImpact triggering = entityImpacts.get(0);
        for (EntityImpact candidate : entityImpacts) {
            if (isWorse(candidate, triggering)) {
                triggering = candidate;
            }
        }

        OverallImpact overall = OverallImpact.builder()
                .worstImpactLevel(triggering.getWorstCaseImpactLevel())
                .worstRiskScore(triggering.getWorstCaseRiskScore())
                .triggeringEntity(triggering.getEntity())
                .triggeringPathId(triggering.getDominantPathId())
                .requiresApproval(false)
                .build();

        log.debug("Aggregated {} paths into {} entity impacts, worst level {}",
                scoredPaths.size(), entityImpacts.size(), overall.getWorstImpactLevel());

        return new ImpactAggregationResult(List.copyOf(entityImpacts), overall);
    }

    private EntityImpact toEntityImpact(EntityRef entity, List<DependencyPath> paths) {
        ImpactLevel worstLevel = ImpactLevel.NONE;
        DependencyPath dominant = paths.get(0);
        int cumulative = 0;

        for (DependencyPath path : paths) {
            worstLevel = ImpactLevel.max(worstLevel, path.getImpactLevel());
            cumulative += path.getRiskScore();
            if (path.getRiskScore() > dominant.getRiskScore()) {
                dominant = path;
            }
        }

        return EntityImpact.builder()
                .entity(entity)
                .paths(List.copyOf(paths))
                .worstCaseImpactLevel(worstLevel)
                .worstCaseRiskScore(dominant.getRiskScore())
                .cumulativeRiskScore(cumulative)
                .dominantPathId(dominant.getPathId())
                .build();
    }

    private boolean isWorse(EntityImpact candidate, EntityImpact current) {
        int byLevel = candidate.getWorstCaseImpactLevel().compareTo(current.getWorstCaseImpactLevel());
        if (byLevel != 0) {
            return byLevel > 0;
        }
        return candidate.getWorstCaseRiskScore() > current.getWorstCaseRiskScore();
    }
}
