package com.architecture.memory.dbimpact.model.impact;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A node of the impact graph: an entity plus its business criticality (1-5).
 */
@Value
@Builder(toBuilder = true)
public class GraphNode {

    public static final int MIN_CRITICALITY = 1;
    public static final int MAX_CRITICALITY = 5;
    public static final int DEFAULT_CRITICALITY = 3;

    @NonNull
    EntityRef entity;

    int criticalityLevel;

    // false when the level was defaulted because metadata carried none
    boolean explicitCriticality;

    public static GraphNode withDefaultCriticality(EntityRef entity) {
        return new GraphNode(entity, DEFAULT_CRITICALITY, false);
    }

    /**
     * Node for the given raw criticality; null means "not provided", other values are clamped into 1-5.
     */
    public static GraphNode of(EntityRef entity, Integer rawCriticality) {
        if (rawCriticality == null) {
            return withDefaultCriticality(entity);
        }
        return new GraphNode(entity, clampCriticality(rawCriticality), true);
    }

    public static int clampCriticality(int raw) {
        return Math.max(MIN_CRITICALITY, Math.min(MAX_CRITICALITY, raw));
    }
}
