package com.architecture.memory.dbimpact.repository;

import com.architecture.memory.dbimpact.model.DependencyRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface DependencyRecordRepository extends MongoRepository<DependencyRecord, String> {

    // Direct dependents of the given targets
    List<DependencyRecord> findByProjectIdAndTargetEntityTypeAndTargetEntityIdIn(
            String projectId, String targetEntityType, Collection<Long> targetEntityIds);
}
