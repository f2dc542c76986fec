package com.weatherline.backend.repository;

import com.weatherline.backend.model.ProductionEvent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ProductionEventRepository extends MongoRepository<ProductionEvent, String> {

    @Query(value = "{ 'locationId': ?0, 'timestamp': { '$gte': ?1, '$lte': ?2 } }", sort = "{ 'timestamp': 1 }")
    List<ProductionEvent> findInRange(String locationId, Instant from, Instant to);
}
