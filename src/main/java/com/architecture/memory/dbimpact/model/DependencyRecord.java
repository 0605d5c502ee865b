package com.architecture.memory.dbimpact.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A resolved dependency between two database entities, as written by the schema sync.
 * The source depends on the target. This service only reads these documents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "dependencies")
@CompoundIndex(name = "project_target_idx", def = "{'projectId': 1, 'targetEntityType': 1, 'targetEntityId': 1}")
public class DependencyRecord {

    @Id
    private String id;

    private String projectId;

    // Dependent
    private String sourceEntityType;    // TABLE, VIEW, SP, FUNCTION
    private long sourceEntityId;
    private String sourceEntityName;
    private Integer sourceCriticalityLevel;

    // Dependency
    private String targetEntityType;
    private long targetEntityId;
    private String targetEntityName;
    private Integer targetCriticalityLevel;

    private String dependencyType;      // SELECT, INSERT, UPDATE, DELETE, SCHEMA_DEPENDENCY, ...
}
