package com.agileflow.planning.workgraph.repository;

import com.agileflow.planning.workgraph.model.RebalanceRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RebalanceRecordRepository extends MongoRepository<RebalanceRecord, String> {

    List<RebalanceRecord> findByTeamIdOrderByCreatedAtDesc(String teamId, Pageable pageable);
}
