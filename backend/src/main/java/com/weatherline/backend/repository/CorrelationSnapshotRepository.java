package com.weatherline.backend.repository;

import com.weatherline.backend.model.CorrelationSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * One snapshot per location, keyed by location id.
 */
@Repository
public interface CorrelationSnapshotRepository extends MongoRepository<CorrelationSnapshot, String> {
}
