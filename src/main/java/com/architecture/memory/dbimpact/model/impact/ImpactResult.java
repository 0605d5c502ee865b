package com.architecture.memory.dbimpact.model.impact;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Authoritative outcome of one impact analysis request. Plain data, serializable as-is.
 */
@Value
@Builder
public class ImpactResult {

    EntityRef rootEntity;
    ChangeType changeType;

    // Versioning, for audit replay
    String scoringVersion;
    PolicySnapshot policySnapshot;
    String approvalPolicyVersion;

    // Graph statistics
    int totalPaths;
    int totalEntities;
    int maxDepthReached;
    boolean depthLimitReached;

    // Truncation
    boolean truncated;
    String truncationReason;

    OverallImpact overallImpact;
    List<EntityImpact> entityImpacts;
    List<DependencyPath> paths;
}
