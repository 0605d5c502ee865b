package com.architecture.memory.dbimpact.config;

import lombok.Value;

import java.time.Duration;

/**
 * Limits applied to every impact analysis request.
 */
@Value
public class ImpactAnalysisSettings {

    int maxDepth;
    int maxPaths;
    Duration fetchTimeout;

    public ImpactAnalysisSettings(int maxDepth, int maxPaths, Duration fetchTimeout) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("impact.analysis.max-depth must be positive, was " + maxDepth);
        }
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("impact.analysis.max-paths must be positive, was " + maxPaths);
        }
        if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
            throw new IllegalArgumentException("impact.analysis.fetch-timeout-ms must be positive");
        }
        this.maxDepth = maxDepth;
        this.maxPaths = maxPaths;
        this.fetchTimeout = fetchTimeout;
    }
}
