package com.architecture.memory.dbimpact.dto.impact;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO comparing the same dependency paths scored under each change type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioComparisonResponse {

    private ImpactDecisionResponse.EntitySummary root;
    private String scoringVersion;
    private List<Scenario> scenarios;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Scenario {
        private String changeType;
        private String worstImpactLevel;
        private int worstRiskScore;
        private String triggeringEntity;
        private boolean truncated;
        private boolean requiresApproval;
    }
}
