package com.architecture.memory.dbimpact.dto.impact;

import com.architecture.memory.dbimpact.model.impact.PolicySnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringPolicyResponse {
    private String scoringVersion;
    private String approvalPolicyVersion;
    private PolicySnapshot policySnapshot;
    private int maxDepth;
    private int maxPaths;
}
