package com.architecture.memory.dbimpact.model.impact;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Serializable record of the exact constants a scoring policy used.
 * Stored with every result so that a verdict can be replayed later,
 * even after the live tables change.
 * Table keys are enum constant names (e.g. "DELETE").
 */
@Value
@Builder(toBuilder = true)
public class PolicySnapshot {
    String version;
    double depthDecayFactor;
    double minimumDepthFactor;
    Map<String, Integer> dependencyWeights;
    Map<String, Integer> changeTypeMultipliers;
    int defaultWeight;
    int defaultMultiplier;
    String criticalityScale;
    Map<String, Integer> impactThresholds;
}
