package com.architecture.memory.dbimpact.model.impact;

import lombok.Builder;
import lombok.Value;

/**
 * Worst impact across all entities, plus the approval decision.
 */
@Value
@Builder(toBuilder = true)
public class OverallImpact {

    ImpactLevel worstImpactLevel;
    int worstRiskScore;

    // null when nothing was impacted
    EntityRef triggeringEntity;
    String triggeringPathId;

    // whether the underlying enumeration was cut off at the path limit
    boolean truncated;

    boolean requiresApproval;

    public static OverallImpact empty() {
        return OverallImpact.builder()
                .worstImpactLevel(ImpactLevel.NONE)
                .worstRiskScore(0)
                .triggeringPathId("")
                .build();
    }
}
