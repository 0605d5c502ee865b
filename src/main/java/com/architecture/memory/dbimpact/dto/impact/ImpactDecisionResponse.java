package com.architecture.memory.dbimpact.dto.impact;

import com.architecture.memory.dbimpact.model.impact.ImpactVerdict;
import com.architecture.memory.dbimpact.model.impact.PolicySnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a single impact analysis.
 * Verdict first, then the numbers it was derived from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactDecisionResponse {

    private EntitySummary root;
    private String changeType;                  // CREATE, MODIFY, DELETE
    private ImpactVerdict verdict;
    private AnalysisSummary summary;
    private List<EntityImpactItem> entities;    // Top entities by impact level, then score
    private List<PathItem> paths;               // Only when includePaths=true
    private String scoringVersion;
    private String approvalPolicyVersion;
    private PolicySnapshot policySnapshot;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EntitySummary {
        private String key;                     // "Table:1"
        private String type;
        private long id;
        private String name;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AnalysisSummary {
        private String worstImpactLevel;
        private int worstRiskScore;
        private String triggeringEntity;        // Stable key, null when nothing is impacted
        private String triggeringPathId;
        private boolean requiresApproval;
        private int totalPaths;
        private int totalEntities;
        private int maxDepthReached;
        private boolean depthLimitReached;
        private boolean truncated;
        private String truncationReason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EntityImpactItem {
        private EntitySummary entity;
        private String impactLevel;
        private int worstCaseRiskScore;
        private int cumulativeRiskScore;
        private int pathCount;
        private String dominantPathId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PathItem {
        private String pathId;
        private int depth;
        private List<String> dependencyTypes;
        private int riskScore;
        private String impactLevel;
        private String dominantEntity;
        private String dominantDependencyType;
    }
}
