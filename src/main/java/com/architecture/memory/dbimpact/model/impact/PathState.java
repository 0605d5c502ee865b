package com.architecture.memory.dbimpact.model.impact;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An in-progress traversal path. Never mutated: {@link #extend} returns a new state,
 * so sibling branches never share a node list.
 */
@Value
public class PathState {

    List<EntityRef> nodes;
    List<DependencyType> edges;
    DependencyType maxDependencyType;
    int maxCriticalityLevel;

    private PathState(List<EntityRef> nodes,
                      List<DependencyType> edges,
                      DependencyType maxDependencyType,
                      int maxCriticalityLevel) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("A path state needs at least one node");
        }
        if (nodes.size() != edges.size() + 1) {
            throw new IllegalArgumentException("Invalid path structure: " + nodes.size()
                    + " nodes for " + edges.size() + " edges");
        }
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
        this.maxDependencyType = maxDependencyType;
        this.maxCriticalityLevel = maxCriticalityLevel;
    }

    /**
     * Seed state at depth 0.
     */
    public static PathState root(EntityRef root, int criticalityLevel) {
        Objects.requireNonNull(root, "root");
        List<EntityRef> nodes = new ArrayList<>(1);
        nodes.add(root);
        return new PathState(nodes, new ArrayList<>(0), DependencyType.UNKNOWN, criticalityLevel);
    }

    /**
     * New state one hop further along {@code edge}.
     */
    public PathState extend(GraphEdge edge, int targetCriticality) {
        if (!edge.getFrom().equals(getCurrent())) {
            throw new IllegalArgumentException("Edge " + edge.getFrom().getStableKey()
                    + " does not start at " + getCurrent().getStableKey());
        }
        List<EntityRef> nextNodes = new ArrayList<>(nodes.size() + 1);
        nextNodes.addAll(nodes);
        nextNodes.add(edge.getTo());

        List<DependencyType> nextEdges = new ArrayList<>(edges.size() + 1);
        nextEdges.addAll(edges);
        nextEdges.add(edge.getDependencyType());

        return new PathState(nextNodes, nextEdges,
                maxDependencyType.max(edge.getDependencyType()),
                Math.max(maxCriticalityLevel, targetCriticality));
    }

    public EntityRef getCurrent() {
        return nodes.get(nodes.size() - 1);
    }

    public int getDepth() {
        return edges.size();
    }

    public boolean contains(EntityRef entity) {
        return nodes.contains(entity);
    }

    public String pathId() {
        StringBuilder id = new StringBuilder();
        for (EntityRef node : nodes) {
            if (id.length() > 0) id.append("->");
            id.append(node.getStableKey());
        }
        return id.toString();
    }
}
