package com.architecture.memory.dbimpact.controller;

import com.architecture.memory.dbimpact.dto.impact.ImpactDecisionResponse;
import com.architecture.memory.dbimpact.dto.impact.ScenarioComparisonResponse;
import com.architecture.memory.dbimpact.dto.impact.ScoringPolicyResponse;
import com.architecture.memory.dbimpact.model.impact.ChangeType;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.EntityType;
import com.architecture.memory.dbimpact.model.impact.ImpactDecision;
import com.architecture.memory.dbimpact.model.impact.OverallImpact;
import com.architecture.memory.dbimpact.service.impact.ImpactAnalysisService;
import com.architecture.memory.dbimpact.service.impact.ImpactResponseMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for change impact analysis.
 * Answers "what breaks if this table, view, procedure or function changes?"
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ImpactController {

    private final ImpactAnalysisService impactAnalysisService;
    private final ImpactResponseMapper responseMapper;

    /**
     * Analyze the impact of changing one entity.
     *
     * @param projectId    The project ID
     * @param entityType   Table, View, StoredProcedure (or SP), Function
     * @param entityId     Numeric entity ID
     * @param changeType   CREATE, MODIFY or DELETE (default: MODIFY)
     * @param includePaths Whether to return every scored path (default: false)
     */
    @GetMapping("/projects/{projectId}/impact/{entityType}/{entityId}")
    public ResponseEntity<ImpactDecisionResponse> analyzeImpact(
            @PathVariable String projectId,
            @PathVariable String entityType,
            @PathVariable long entityId,
            @RequestParam(defaultValue = "MODIFY") String changeType,
            @RequestParam(defaultValue = "false") boolean includePaths) {
        log.info("Impact request: project={}, entity={}:{}, changeType={}", projectId, entityType, entityId, changeType);

        EntityRef root = EntityRef.of(parseEntityType(entityType), entityId);
        ImpactDecision decision = impactAnalysisService.analyzeWithVerdict(
                projectId, root, ChangeType.fromString(changeType));
        return ResponseEntity.ok(responseMapper.toDecisionResponse(decision, includePaths));
    }

    /**
     * Compare the same entity change under every change type.
     */
    @GetMapping("/projects/{projectId}/impact/{entityType}/{entityId}/scenarios")
    public ResponseEntity<ScenarioComparisonResponse> compareScenarios(
            @PathVariable String projectId,
            @PathVariable String entityType,
            @PathVariable long entityId) {
        log.info("Scenario comparison request: project={}, entity={}:{}", projectId, entityType, entityId);

        EntityRef root = EntityRef.of(parseEntityType(entityType), entityId);
        Map<ChangeType, OverallImpact> outcomes = impactAnalysisService.compareChangeTypes(projectId, root);
        return ResponseEntity.ok(responseMapper.toScenarioResponse(root, outcomes));
    }

    /**
     * Get the live scoring policy and approval policy version.
     */
    @GetMapping("/impact/policy")
    public ResponseEntity<ScoringPolicyResponse> getScoringPolicy() {
        return ResponseEntity.ok(responseMapper.toPolicyResponse());
    }

    private EntityType parseEntityType(String value) {
        EntityType type = EntityType.fromString(value);
        if (type == null) {
            throw new IllegalArgumentException("Unsupported entityType '" + value + "'");
        }
        return type;
    }
}
