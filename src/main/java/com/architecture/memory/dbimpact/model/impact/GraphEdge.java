package com.architecture.memory.dbimpact.model.impact;

import lombok.NonNull;
import lombok.Value;

/**
 * Directed edge from a dependency to one of its dependents.
 */
@Value
public class GraphEdge {

    @NonNull
    EntityRef from;     // the entity depended upon

    @NonNull
    EntityRef to;       // the dependent

    @NonNull
    DependencyType dependencyType;
}
