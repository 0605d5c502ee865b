package com.architecture.memory.dbimpact.service.impact.engine;

import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.ImpactGraph;
import com.architecture.memory.dbimpact.model.impact.PathEnumerationResult;

/**
 * Enumerates dependent paths from a root entity.
 */
public interface PathEnumerator {

    /**
     * @param maxDepth maximum number of edges per path, must be positive
     * @param maxPaths maximum number of emitted paths, must be positive
     * @throws IllegalArgumentException when a limit is not positive
     * @throws IllegalStateException    when the root is not part of the graph
     */
    PathEnumerationResult enumerate(ImpactGraph graph, EntityRef root, int maxDepth, int maxPaths);
}
