package com.architecture.memory.dbimpact.model.impact;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A finished root-to-dependent path. Created unscored by the enumerator;
 * scoring produces a new copy with risk score and impact level filled in.
 */
@Value
@Builder(toBuilder = true)
public class DependencyPath {

    String pathId;
    List<EntityRef> nodes;
    List<DependencyType> edges;
    int depth;
    DependencyType maxDependencyType;
    int maxCriticalityLevel;

    // Scoring output
    int riskScore;
    ImpactLevel impactLevel;
    boolean scored;

    // Explainability
    EntityRef dominantEntity;
    DependencyType dominantDependencyType;

    /**
     * Unscored path for a finished traversal state.
     */
    public static DependencyPath fromState(PathState state) {
        return DependencyPath.builder()
                .pathId(state.pathId())
                .nodes(state.getNodes())
                .edges(state.getEdges())
                .depth(state.getDepth())
                .maxDependencyType(state.getMaxDependencyType())
                .maxCriticalityLevel(state.getMaxCriticalityLevel())
                .riskScore(0)
                .impactLevel(ImpactLevel.NONE)
                .scored(false)
                .dominantEntity(state.getCurrent())
                .dominantDependencyType(state.getMaxDependencyType())
                .build();
    }

    @JsonIgnore
    public EntityRef getTerminalEntity() {
        return nodes.get(nodes.size() - 1);
    }
}
