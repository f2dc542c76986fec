package com.weatherline.backend.repository;

import com.weatherline.backend.model.EnrichedProductionEvent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for production events stored together with their weather context.
 */
@Repository
public interface EnrichedProductionEventRepository extends MongoRepository<EnrichedProductionEvent, String> {
}
