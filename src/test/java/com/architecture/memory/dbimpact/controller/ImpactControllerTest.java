package com.architecture.memory.dbimpact.controller;

import com.architecture.memory.dbimpact.config.ImpactAnalysisSettings;
import com.architecture.memory.dbimpact.exception.DependencyFetchException;
import com.architecture.memory.dbimpact.exception.GlobalExceptionHandler;
import com.architecture.memory.dbimpact.exception.InvalidDependencyMetadataException;
import com.architecture.memory.dbimpact.model.impact.ChangeType;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.EntityType;
import com.architecture.memory.dbimpact.model.impact.ImpactDecision;
import com.architecture.memory.dbimpact.model.impact.ImpactLevel;
import com.architecture.memory.dbimpact.model.impact.ImpactResult;
import com.architecture.memory.dbimpact.model.impact.OverallImpact;
import com.architecture.memory.dbimpact.service.impact.ImpactAnalysisService;
import com.architecture.memory.dbimpact.service.impact.ImpactResponseMapper;
import com.architecture.memory.dbimpact.service.impact.engine.ApprovalPolicyV1;
import com.architecture.memory.dbimpact.service.impact.engine.ImpactVerdictBuilder;
import com.architecture.memory.dbimpact.service.impact.engine.PathRiskEvaluatorV1;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ImpactControllerTest {

    private static final EntityRef TABLE_1 = EntityRef.of(EntityType.TABLE, 1);

    @Mock
    private ImpactAnalysisService impactAnalysisService;

    private final PathRiskEvaluatorV1 evaluator = new PathRiskEvaluatorV1();
    private final ApprovalPolicyV1 approvalPolicy = new ApprovalPolicyV1();

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ImpactResponseMapper mapper = new ImpactResponseMapper(impactAnalysisService,
                new ImpactAnalysisSettings(10, 1000, Duration.ofSeconds(5)));
        mockMvc = MockMvcBuilders.standaloneSetup(new ImpactController(impactAnalysisService, mapper))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void returnsVerdictForEntityWithoutDependents() throws Exception {
        when(impactAnalysisService.analyzeWithVerdict("p1", TABLE_1, ChangeType.DELETE))
                .thenReturn(emptyDecision(ChangeType.DELETE));

        mockMvc.perform(get("/api/projects/p1/impact/table/1").param("changeType", "delete"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.root.key").value("Table:1"))
                .andExpect(jsonPath("$.changeType").value("DELETE"))
                .andExpect(jsonPath("$.verdict.requiresApproval").value(false))
                .andExpect(jsonPath("$.verdict.reasons[0].statement").value("No dependent entities detected"))
                .andExpect(jsonPath("$.summary.worstImpactLevel").value("NONE"))
                .andExpect(jsonPath("$.scoringVersion").value(PathRiskEvaluatorV1.VERSION))
                .andExpect(jsonPath("$.policySnapshot.dependencyWeights.DELETE").value(10))
                .andExpect(jsonPath("$.paths").doesNotExist());
    }

    @Test
    void acceptsStoredProcedureAliasAndDefaultsToModify() throws Exception {
        EntityRef sp = EntityRef.of(EntityType.STORED_PROCEDURE, 42);
        when(impactAnalysisService.analyzeWithVerdict(eq("p1"), eq(sp), eq(ChangeType.MODIFY)))
                .thenReturn(emptyDecision(ChangeType.MODIFY));

        mockMvc.perform(get("/api/projects/p1/impact/SP/42"))
                .andExpect(status().isOk());

        verify(impactAnalysisService).analyzeWithVerdict("p1", sp, ChangeType.MODIFY);
    }

    @Test
    void unknownEntityTypeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/projects/p1/impact/trigger/1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Unsupported entityType 'trigger'"));
    }

    @Test
    void unknownChangeTypeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/projects/p1/impact/table/1").param("changeType", "RENAME"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unsupported changeType 'RENAME'"));
    }

    @Test
    void invalidMetadataIsUnprocessable() throws Exception {
        when(impactAnalysisService.analyzeWithVerdict(any(), any(), any()))
                .thenThrow(new InvalidDependencyMetadataException("Unknown entity type 'TRIGGER' in dependency metadata"));

        mockMvc.perform(get("/api/projects/p1/impact/table/1"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.path").value("/api/projects/p1/impact/table/1"));
    }

    @Test
    void fetchTimeoutIsGatewayTimeout() throws Exception {
        when(impactAnalysisService.analyzeWithVerdict(any(), any(), any()))
                .thenThrow(new DependencyFetchException("Timed out", null, true));

        mockMvc.perform(get("/api/projects/p1/impact/table/1"))
                .andExpect(status().isGatewayTimeout());
    }

    @Test
    void fetchFailureIsBadGateway() throws Exception {
        when(impactAnalysisService.analyzeWithVerdict(any(), any(), any()))
                .thenThrow(new DependencyFetchException("Connection refused", null, false));

        mockMvc.perform(get("/api/projects/p1/impact/table/1"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void comparesScenariosPerChangeType() throws Exception {
        Map<ChangeType, OverallImpact> outcomes = new EnumMap<>(ChangeType.class);
        outcomes.put(ChangeType.CREATE, OverallImpact.empty().toBuilder()
                .worstImpactLevel(ImpactLevel.LOW).worstRiskScore(12).triggeringEntity(TABLE_1).build());
        outcomes.put(ChangeType.MODIFY, OverallImpact.empty().toBuilder()
                .worstImpactLevel(ImpactLevel.MEDIUM).worstRiskScore(24).build());
        outcomes.put(ChangeType.DELETE, OverallImpact.empty().toBuilder()
                .worstImpactLevel(ImpactLevel.HIGH).worstRiskScore(36).requiresApproval(true).build());
        when(impactAnalysisService.compareChangeTypes("p1", TABLE_1)).thenReturn(outcomes);
        when(impactAnalysisService.getRiskEvaluator()).thenReturn(evaluator);

        mockMvc.perform(get("/api/projects/p1/impact/table/1/scenarios"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scenarios.length()").value(3))
                .andExpect(jsonPath("$.scenarios[0].changeType").value("CREATE"))
                .andExpect(jsonPath("$.scenarios[0].triggeringEntity").value("Table:1"))
                .andExpect(jsonPath("$.scenarios[2].changeType").value("DELETE"))
                .andExpect(jsonPath("$.scenarios[2].requiresApproval").value(true));
    }

    @Test
    void exposesLivePolicy() throws Exception {
        when(impactAnalysisService.getRiskEvaluator()).thenReturn(evaluator);
        when(impactAnalysisService.getApprovalPolicy()).thenReturn(approvalPolicy);

        mockMvc.perform(get("/api/impact/policy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scoringVersion").value(PathRiskEvaluatorV1.VERSION))
                .andExpect(jsonPath("$.approvalPolicyVersion").value(ApprovalPolicyV1.VERSION))
                .andExpect(jsonPath("$.policySnapshot.impactThresholds.CRITICAL").value(50))
                .andExpect(jsonPath("$.maxPaths").value(1000));
    }

    private ImpactDecision emptyDecision(ChangeType changeType) {
        ImpactResult result = ImpactResult.builder()
                .rootEntity(TABLE_1)
                .changeType(changeType)
                .scoringVersion(evaluator.getVersion())
                .policySnapshot(evaluator.getPolicySnapshot())
                .approvalPolicyVersion(approvalPolicy.getVersion())
                .overallImpact(approvalPolicy.apply(OverallImpact.empty()))
                .entityImpacts(List.of())
                .paths(List.of())
                .build();
        return new ImpactDecision(result, new ImpactVerdictBuilder(Clock.systemUTC()).build(result));
    }
}
