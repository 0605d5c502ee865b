package com.architecture.memory.dbimpact.service.impact;

import com.architecture.memory.dbimpact.config.ImpactAnalysisSettings;
import com.architecture.memory.dbimpact.dto.impact.ImpactDecisionResponse;
import com.architecture.memory.dbimpact.dto.impact.ScenarioComparisonResponse;
import com.architecture.memory.dbimpact.dto.impact.ScoringPolicyResponse;
import com.architecture.memory.dbimpact.model.impact.ChangeType;
import com.architecture.memory.dbimpact.model.impact.DependencyPath;
import com.architecture.memory.dbimpact.model.impact.DependencyType;
import com.architecture.memory.dbimpact.model.impact.EntityImpact;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.ImpactDecision;
import com.architecture.memory.dbimpact.model.impact.ImpactResult;
import com.architecture.memory.dbimpact.model.impact.OverallImpact;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Converts analysis results into API responses.
 */
@Component
@RequiredArgsConstructor
public class ImpactResponseMapper {

    static final int TOP_ENTITIES = 10;

    private final ImpactAnalysisService impactAnalysisService;
    private final ImpactAnalysisSettings settings;

    public ImpactDecisionResponse toDecisionResponse(ImpactDecision decision, boolean includePaths) {
        ImpactResult result = decision.getResult();

        return ImpactDecisionResponse.builder()
                .root(toEntitySummary(result.getRootEntity()))
                .changeType(result.getChangeType().name())
                .verdict(decision.getVerdict())
                .summary(toAnalysisSummary(result))
                .entities(topEntities(result.getEntityImpacts()))
                .paths(includePaths ? result.getPaths().stream().map(this::toPathItem).toList() : null)
                .scoringVersion(result.getScoringVersion())
                .approvalPolicyVersion(result.getApprovalPolicyVersion())
                .policySnapshot(result.getPolicySnapshot())
                .build();
    }

    public ScenarioComparisonResponse toScenarioResponse(EntityRef root, Map<ChangeType, OverallImpact> outcomes) {
        List<ScenarioComparisonResponse.Scenario> scenarios = outcomes.entrySet().stream()
                .map(entry -> ScenarioComparisonResponse.Scenario.builder()
                        .changeType(entry.getKey().name())
                        .worstImpactLevel(entry.getValue().getWorstImpactLevel().name())
                        .worstRiskScore(entry.getValue().getWorstRiskScore())
                        .triggeringEntity(stableKeyOrNull(entry.getValue().getTriggeringEntity()))
                        .truncated(entry.getValue().isTruncated())
                        .requiresApproval(entry.getValue().isRequiresApproval())
                        .build())
                .toList();

        return ScenarioComparisonResponse.builder()
                .root(toEntitySummary(root))
                .scoringVersion(impactAnalysisService.getRiskEvaluator().getVersion())
                .scenarios(scenarios)
                .build();
    }

    public ScoringPolicyResponse toPolicyResponse() {
        return ScoringPolicyResponse.builder()
                .scoringVersion(impactAnalysisService.getRiskEvaluator().getVersion())
                .approvalPolicyVersion(impactAnalysisService.getApprovalPolicy().getVersion())
                .policySnapshot(impactAnalysisService.getRiskEvaluator().getPolicySnapshot())
                .maxDepth(settings.getMaxDepth())
                .maxPaths(settings.getMaxPaths())
                .build();
    }

    private ImpactDecisionResponse.AnalysisSummary toAnalysisSummary(ImpactResult result) {
        OverallImpact overall = result.getOverallImpact();
        return ImpactDecisionResponse.AnalysisSummary.builder()
                .worstImpactLevel(overall.getWorstImpactLevel().name())
                .worstRiskScore(overall.getWorstRiskScore())
                .triggeringEntity(stableKeyOrNull(overall.getTriggeringEntity()))
                .triggeringPathId(overall.getTriggeringPathId())
                .requiresApproval(overall.isRequiresApproval())
                .totalPaths(result.getTotalPaths())
                .totalEntities(result.getTotalEntities())
                .maxDepthReached(result.getMaxDepthReached())
                .depthLimitReached(result.isDepthLimitReached())
                .truncated(result.isTruncated())
                .truncationReason(result.getTruncationReason())
                .build();
    }

    private List<ImpactDecisionResponse.EntityImpactItem> topEntities(List<EntityImpact> impacts) {
        return impacts.stream()
                .sorted(Comparator.comparing(EntityImpact::getWorstCaseImpactLevel).reversed()
                        .thenComparing(Comparator.comparingInt(EntityImpact::getWorstCaseRiskScore).reversed()))
                .limit(TOP_ENTITIES)
                .map(impact -> ImpactDecisionResponse.EntityImpactItem.builder()
                        .entity(toEntitySummary(impact.getEntity()))
                        .impactLevel(impact.getWorstCaseImpactLevel().name())
                        .worstCaseRiskScore(impact.getWorstCaseRiskScore())
                        .cumulativeRiskScore(impact.getCumulativeRiskScore())
                        .pathCount(impact.getPaths().size())
                        .dominantPathId(impact.getDominantPathId())
                        .build())
                .toList();
    }

    private ImpactDecisionResponse.PathItem toPathItem(DependencyPath path) {
        return ImpactDecisionResponse.PathItem.builder()
                .pathId(path.getPathId())
                .depth(path.getDepth())
                .dependencyTypes(path.getEdges().stream().map(DependencyType::name).toList())
                .riskScore(path.getRiskScore())
                .impactLevel(path.getImpactLevel().name())
                .dominantEntity(stableKeyOrNull(path.getDominantEntity()))
                .dominantDependencyType(path.getDominantDependencyType() != null
                        ? path.getDominantDependencyType().name() : null)
                .build();
    }

    private ImpactDecisionResponse.EntitySummary toEntitySummary(EntityRef entity) {
        return ImpactDecisionResponse.EntitySummary.builder()
                .key(entity.getStableKey())
                .type(entity.getType().getValue())
                .id(entity.getId())
                .name(entity.getName())
                .build();
    }

    private static String stableKeyOrNull(EntityRef entity) {
        return entity != null ? entity.getStableKey() : null;
    }
}
