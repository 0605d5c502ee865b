package com.architecture.memory.dbimpact.model.impact;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Output of a bounded path enumeration.
 */
@Value
@Builder
public class PathEnumerationResult {

    public static final String PATH_LIMIT = "PATH_LIMIT";

    List<DependencyPath> paths;

    // true when the path limit stopped the run with candidates left; results are a lower bound
    boolean truncated;
    String truncationReason;

    int maxDepthReached;

    // a branch stopped at maxDepth while its last entity still had dependents
    boolean depthLimitReached;
}
