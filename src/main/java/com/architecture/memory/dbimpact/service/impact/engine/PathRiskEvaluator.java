package com.architecture.memory.dbimpact.service.impact.engine;

import com.architecture.memory.dbimpact.model.impact.ChangeType;
import com.architecture.memory.dbimpact.model.impact.DependencyPath;
import com.architecture.memory.dbimpact.model.impact.PolicySnapshot;

/**
 * Scores a dependency path under a proposed change.
 * Implementations must be deterministic and must not mutate their input.
 */
public interface PathRiskEvaluator {

    String getVersion();

    /**
     * Exact constants used by {@link #evaluate}, for embedding into results.
     */
    PolicySnapshot getPolicySnapshot();

    /**
     * @return a new, scored copy of {@code path}
     * @throws IllegalArgumentException when the path is empty or has depth below 1
     */
    DependencyPath evaluate(DependencyPath path, ChangeType changeType);
}
