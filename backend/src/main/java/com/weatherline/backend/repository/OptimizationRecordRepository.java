package com.weatherline.backend.repository;

import com.weatherline.backend.model.OptimizationRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OptimizationRecordRepository extends MongoRepository<OptimizationRecord, String> {

    List<OptimizationRecord> findByLocationIdOrderByTimestampDesc(String locationId);
}
