package com.architecture.memory.dbimpact.service.impact.engine;

import com.architecture.memory.dbimpact.model.impact.OverallImpact;

/**
 * Decides whether an aggregated impact requires manual approval.
 * Versioned independently of the scoring policy.
 */
public interface ApprovalPolicy {

    String getVersion();

    boolean requiresApproval(OverallImpact overallImpact);

    /**
     * Copy of {@code overallImpact} carrying this policy's decision.
     */
    default OverallImpact apply(OverallImpact overallImpact) {
        return overallImpact.toBuilder()
                .requiresApproval(requiresApproval(overallImpact))
                .build();
    }
}
