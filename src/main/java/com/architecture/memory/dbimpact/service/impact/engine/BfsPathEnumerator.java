package com.architecture.memory.dbimpact.service.impact.engine;

import com.architecture.memory.dbimpact.model.impact.DependencyPath;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.GraphEdge;
import com.architecture.memory.dbimpact.model.impact.GraphNode;
import com.architecture.memory.dbimpact.model.impact.ImpactGraph;
import com.architecture.memory.dbimpact.model.impact.PathEnumerationResult;
import com.architecture.memory.dbimpact.model.impact.PathState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Breadth-first, bounded path enumerator.
 *
 * <p>Every non-root state is emitted as a path, so intermediate dependents are reported
 * and not only leaves. A path never visits the same entity twice: an edge is only
 * followed when its target is not already on the state's own node list, which also
 * guarantees termination on cyclic metadata.</p>
 *
 * <p>The run stops once {@code maxPaths} paths were emitted and another candidate exists;
 * the result is then flagged as truncated and must be read as a lower bound.</p>
 */
@Component
@Slf4j
public class BfsPathEnumerator implements PathEnumerator {

    @Override
    public PathEnumerationResult enumerate(ImpactGraph graph, EntityRef root, int maxDepth, int maxPaths) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(root, "root");
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("maxPaths must be positive, was " + maxPaths);
        }

        GraphNode rootNode = graph.getNode(root);
        if (rootNode == null) {
            throw new IllegalStateException("Root entity '" + root.getStableKey()
                    + "' not found in graph. Ensure the graph contains the root before enumeration.");
        }

        List<DependencyPath> paths = new ArrayList<>();
        Deque<PathState> queue = new ArrayDeque<>();
        queue.add(PathState.root(rootNode.getEntity(), rootNode.getCriticalityLevel()));

        boolean truncated = false;
        boolean depthLimitReached = false;
        int maxDepthReached = 0;

        expansion:
        while (!queue.isEmpty()) {
            PathState current = queue.poll();

            for (GraphEdge edge : graph.getOutgoingEdges(current.getCurrent())) {
                if (current.contains(edge.getTo())) {
                    continue;
                }

                GraphNode target = graph.getNode(edge.getTo());
                if (target == null) {
                    log.debug("Edge target {} is not a registered node, skipping", edge.getTo().getStableKey());
                    continue;
                }

                if (paths.size() >= maxPaths) {
                    truncated = true;
                    break expansion;
                }

                PathState next = current.extend(edge, target.getCriticalityLevel());
                paths.add(DependencyPath.fromState(next));
                maxDepthReached = Math.max(maxDepthReached, next.getDepth());

                if (next.getDepth() < maxDepth) {
                    queue.add(next);
                } else if (hasUnvisitedDependents(graph, next)) {
                    depthLimitReached = true;
                }
            }
        }

        if (truncated) {
            log.warn("Path enumeration from {} truncated at {} paths; impact is a lower bound",
                    root.getStableKey(), maxPaths);
        }
        log.debug("Enumerated {} paths from {} (max depth reached {}, depth limit hit: {})",
                paths.size(), root.getStableKey(), maxDepthReached, depthLimitReached);

        return PathEnumerationResult.builder()
                .paths(List.copyOf(paths))
                .truncated(truncated)
                .truncationReason(truncated ? PathEnumerationResult.PATH_LIMIT : null)
                .maxDepthReached(maxDepthReached)
                .depthLimitReached(depthLimitReached)
                .build();
    }

    private boolean hasUnvisitedDependents(ImpactGraph graph, PathState state) {
        for (GraphEdge edge : graph.getOutgoingEdges(state.getCurrent())) {
            if (!state.contains(edge.getTo())) {
                return true;
            }
        }
        return false;
    }
}
