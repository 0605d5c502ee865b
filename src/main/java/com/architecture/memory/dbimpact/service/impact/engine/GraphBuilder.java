package com.architecture.memory.dbimpact.service.impact.engine;

import com.architecture.memory.dbimpact.exception.InvalidDependencyMetadataException;
import com.architecture.memory.dbimpact.model.impact.DependencyGraphRow;
import com.architecture.memory.dbimpact.model.impact.DependencyType;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.model.impact.EntityType;
import com.architecture.memory.dbimpact.model.impact.GraphEdge;
import com.architecture.memory.dbimpact.model.impact.GraphNode;
import com.architecture.memory.dbimpact.model.impact.ImpactGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds an immutable {@link ImpactGraph} from raw dependency rows.
 * Pure normalization: no traversal, no scoring.
 */
@Component
@Slf4j
public class GraphBuilder {

    public ImpactGraph build(List<DependencyGraphRow> rows) {
        Map<EntityRef, GraphNode> nodes = new LinkedHashMap<>();
        Map<EntityRef, List<GraphEdge>> adjacency = new LinkedHashMap<>();
        int unknownDependencyTypes = 0;

        for (DependencyGraphRow row : rows) {
            EntityRef dependent = new EntityRef(
                    parseEntityType(row.getSourceEntityType()),
                    row.getSourceEntityId(),
                    row.getSourceEntityName());

            EntityRef dependency = new EntityRef(
                    parseEntityType(row.getTargetEntityType()),
                    row.getTargetEntityId(),
                    row.getTargetEntityName());

            register(nodes, dependent, row.getSourceCriticalityLevel());
            register(nodes, dependency, row.getTargetCriticalityLevel());

            DependencyType dependencyType = DependencyType.fromString(row.getDependencyType());
            if (dependencyType == DependencyType.UNKNOWN
                    && !DependencyType.UNKNOWN.name().equalsIgnoreCase(String.valueOf(row.getDependencyType()).trim())) {
                unknownDependencyTypes++;
                log.debug("Unrecognized dependency type '{}' on {} -> {}, treating as Unknown",
                        row.getDependencyType(), dependency.getStableKey(), dependent.getStableKey());
            }

            adjacency.computeIfAbsent(dependency, k -> new ArrayList<>())
                    .add(new GraphEdge(dependency, dependent, dependencyType));
        }

        if (unknownDependencyTypes > 0) {
            log.warn("{} dependency row(s) carried an unrecognized dependency type and were scored as Unknown",
                    unknownDependencyTypes);
        }

        ImpactGraph graph = new ImpactGraph(nodes, adjacency);
        log.debug("Built impact graph: {} nodes, {} edges from {} rows",
                graph.nodeCount(), graph.edgeCount(), rows.size());
        return graph;
    }

    /**
     * Adds the node if new. An explicit criticality replaces a defaulted one; the first explicit value wins,
     * so the outcome does not depend on row order.
     */
    private void register(Map<EntityRef, GraphNode> nodes, EntityRef entity, Integer rawCriticality) {
        GraphNode existing = nodes.get(entity);
        if (existing == null) {
            nodes.put(entity, GraphNode.of(entity, rawCriticality));
            return;
        }

        if (!existing.isExplicitCriticality() && rawCriticality != null) {
            nodes.put(entity, GraphNode.of(preferNamed(existing.getEntity(), entity), rawCriticality));
        } else if (existing.getEntity().getName() == null && entity.getName() != null) {
            nodes.put(entity, existing.toBuilder().entity(entity).build());
        }
    }

    private EntityRef preferNamed(EntityRef existing, EntityRef incoming) {
        return existing.getName() != null ? existing : incoming;
    }

    private EntityType parseEntityType(String raw) {
        EntityType type = EntityType.fromString(raw);
        if (type == null) {
            throw new InvalidDependencyMetadataException(
                    "Unknown entity type '" + raw + "' in dependency metadata");
        }
        return type;
    }
}
