package com.architecture.memory.dbimpact.service.impact.engine;

import com.architecture.memory.dbimpact.model.impact.ImpactLevel;
import com.architecture.memory.dbimpact.model.impact.OverallImpact;
import org.springframework.stereotype.Component;

/**
 * Approval policy v1.
 *
 * <ul>
 *   <li>HIGH or CRITICAL worst-case impact requires approval</li>
 *   <li>a truncated enumeration requires approval, because it cannot prove a lower risk</li>
 *   <li>everything else does not</li>
 * </ul>
 */
@Component
public class ApprovalPolicyV1 implements ApprovalPolicy {

    public static final String VERSION = "approval-v1";

    @Override
    public String getVersion() {
        return VERSION;
    }

    @Override
    public boolean requiresApproval(OverallImpact overallImpact) {
        if (overallImpact == null) {
            throw new IllegalArgumentException("Overall impact must not be null");
        }
        ImpactLevel worst = overallImpact.getWorstImpactLevel() != null
                ? overallImpact.getWorstImpactLevel()
                : ImpactLevel.NONE;
        return worst.isAtLeast(ImpactLevel.HIGH) || overallImpact.isTruncated();
    }
}
