package com.architecture.memory.dbimpact.service.impact;

import com.architecture.memory.dbimpact.model.impact.DependencyGraphRow;
import com.architecture.memory.dbimpact.model.impact.EntityRef;

import java.util.List;

/**
 * Supplies raw dependency rows from the external metadata repository.
 */
public interface DependencyRowSource {

    /**
     * All rows reachable downstream from {@code root} within {@code maxDepth} levels:
     * rows whose target is the root, then rows whose target is one of those dependents, and so on.
     * Implementations also return the level just past {@code maxDepth}, so that callers can
     * detect dependents cut off by the depth limit.
     */
    List<DependencyGraphRow> fetchDownstreamDependents(String projectId, EntityRef root, int maxDepth);
}
