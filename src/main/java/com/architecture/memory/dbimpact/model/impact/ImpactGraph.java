package com.architecture.memory.dbimpact.model.impact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable directed graph optimized for "who depends on me" lookups.
 * Adjacency is keyed by the dependency entity.
 */
public final class ImpactGraph {

    private final Map<EntityRef, GraphNode> nodes;
    private final Map<EntityRef, List<GraphEdge>> adjacency;
    private final int edgeCount;

    public ImpactGraph(Map<EntityRef, GraphNode> nodes, Map<EntityRef, List<GraphEdge>> adjacency) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(adjacency, "adjacency");

        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));

        Map<EntityRef, List<GraphEdge>> copy = new LinkedHashMap<>();
        int edges = 0;
        for (Map.Entry<EntityRef, List<GraphEdge>> entry : adjacency.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
            edges += entry.getValue().size();
        }
        this.adjacency = Collections.unmodifiableMap(copy);
        this.edgeCount = edges;
    }

    public static ImpactGraph empty() {
        return new ImpactGraph(Map.of(), Map.of());
    }

    public boolean contains(EntityRef entity) {
        return nodes.containsKey(entity);
    }

    /**
     * @return the node, or null when the entity is not part of the graph
     */
    public GraphNode getNode(EntityRef entity) {
        return nodes.get(entity);
    }

    /**
     * Edges to the dependents of {@code from}; empty when nothing depends on it.
     */
    public List<GraphEdge> getOutgoingEdges(EntityRef from) {
        return adjacency.getOrDefault(from, List.of());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }
}
