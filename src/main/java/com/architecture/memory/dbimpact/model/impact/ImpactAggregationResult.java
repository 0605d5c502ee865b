package com.architecture.memory.dbimpact.model.impact;

import lombok.Value;

import java.util.List;

@Value
public class ImpactAggregationResult {
    List<EntityImpact> entityImpacts;
    OverallImpact overallImpact;
}
