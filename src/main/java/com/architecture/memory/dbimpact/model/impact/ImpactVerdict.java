package com.architecture.memory.dbimpact.model.impact;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Compact, human-readable decision rendered from an {@link ImpactResult}.
 */
@Value
@Builder
public class ImpactVerdict {
    RiskLevel risk;
    boolean requiresApproval;
    String summary;
    List<VerdictReason> reasons;
    List<String> limitations;
    Instant generatedAt;
}
