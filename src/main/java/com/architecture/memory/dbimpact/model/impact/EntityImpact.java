package com.architecture.memory.dbimpact.model.impact;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Worst-case impact on one dependent entity, over every path that reaches it.
 */
@Value
@Builder
public class EntityImpact {
    EntityRef entity;
    List<DependencyPath> paths;
    ImpactLevel worstCaseImpactLevel;
    int worstCaseRiskScore;
    int cumulativeRiskScore;
    String dominantPathId;
}
