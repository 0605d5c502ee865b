package com.architecture.memory.dbimpact.model.impact;

import lombok.Builder;
import lombok.Value;

/**
 * One raw dependency as delivered by the metadata repository.
 * The source is the dependent (the impacted entity), the target is what it depends on.
 * Type strings are kept raw; they are parsed when the graph is built.
 */
@Value
@Builder
public class DependencyGraphRow {

    String sourceEntityType;
    long sourceEntityId;
    String sourceEntityName;
    Integer sourceCriticalityLevel;

    String targetEntityType;
    long targetEntityId;
    String targetEntityName;
    Integer targetCriticalityLevel;

    String dependencyType;

    // Traversal level at which the repository found this row (informational)
    int depth;
}
