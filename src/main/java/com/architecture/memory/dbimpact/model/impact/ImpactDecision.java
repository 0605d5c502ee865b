package com.architecture.memory.dbimpact.model.impact;

import lombok.Value;

/**
 * An analysis result together with the verdict rendered from it.
 */
@Value
public class ImpactDecision {
    ImpactResult result;
    ImpactVerdict verdict;
}
