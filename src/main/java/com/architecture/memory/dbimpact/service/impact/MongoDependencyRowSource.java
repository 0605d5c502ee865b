package com.architecture.memory.dbimpact.service.impact;

import com.architecture.memory.dbimpact.model.DependencyRecord;
import com.architecture.memory.dbimpact.model.impact.DependencyGraphRow;
import com.architecture.memory.dbimpact.model.impact.EntityRef;
import com.architecture.memory.dbimpact.repository.DependencyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads downstream dependency rows from MongoDB, one level per round trip.
 * Each entity is expanded at most once, so cyclic metadata terminates.
 *
 * <p>One level past {@code maxDepth} is also loaded. Paths never extend into it, but the
 * enumerator needs those rows to tell that entities at the depth limit have dependents.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoDependencyRowSource implements DependencyRowSource {

    private final DependencyRecordRepository dependencyRecordRepository;

    @Override
    public List<DependencyGraphRow> fetchDownstreamDependents(String projectId, EntityRef root, int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, was " + maxDepth);
        }

        String rootType = root.getType().getStorageCode();
        Set<String> expanded = new HashSet<>();
        expanded.add(entityKey(rootType, root.getId()));

        Map<String, Set<Long>> frontier = new LinkedHashMap<>();
        frontier.computeIfAbsent(rootType, k -> new LinkedHashSet<>()).add(root.getId());

        Set<String> seenRecords = new HashSet<>();
        List<DependencyGraphRow> rows = new ArrayList<>();

        int lastLevel = maxDepth + 1;
        for (int depth = 1; depth <= lastLevel && !frontier.isEmpty(); depth++) {
            Map<String, Set<Long>> next = new LinkedHashMap<>();

            for (Map.Entry<String, Set<Long>> level : frontier.entrySet()) {
                List<DependencyRecord> records = dependencyRecordRepository
                        .findByProjectIdAndTargetEntityTypeAndTargetEntityIdIn(projectId, level.getKey(), level.getValue());

                for (DependencyRecord record : records) {
                    if (!seenRecords.add(recordKey(record))) {
                        continue;
                    }
                    rows.add(toRow(record, depth));

                    if (expanded.add(entityKey(record.getSourceEntityType(), record.getSourceEntityId()))) {
                        next.computeIfAbsent(record.getSourceEntityType(), k -> new LinkedHashSet<>())
                                .add(record.getSourceEntityId());
                    }
                }
            }
            frontier = next;
        }

        log.debug("Fetched {} dependency rows downstream of {} in project {}", rows.size(), root.getStableKey(), projectId);
        return rows;
    }

    private DependencyGraphRow toRow(DependencyRecord record, int depth) {
        return DependencyGraphRow.builder()
                .sourceEntityType(record.getSourceEntityType())
                .sourceEntityId(record.getSourceEntityId())
                .sourceEntityName(record.getSourceEntityName())
                .sourceCriticalityLevel(record.getSourceCriticalityLevel())
                .targetEntityType(record.getTargetEntityType())
                .targetEntityId(record.getTargetEntityId())
                .targetEntityName(record.getTargetEntityName())
                .targetCriticalityLevel(record.getTargetCriticalityLevel())
                .dependencyType(record.getDependencyType())
                .depth(depth)
                .build();
    }

    private String entityKey(String type, long id) {
        return type + ":" + id;
    }

    private String recordKey(DependencyRecord record) {
        if (record.getId() != null) {
            return record.getId();
        }
        return entityKey(record.getSourceEntityType(), record.getSourceEntityId()) + "->"
                + entityKey(record.getTargetEntityType(), record.getTargetEntityId()) + ":" + record.getDependencyType();
    }
}
