package com.agileflow.planning.workgraph.repository;

import com.agileflow.planning.workgraph.model.ActivityEvent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface ActivityEventRepository extends MongoRepository<ActivityEvent, String> {

    long deleteByCreatedAtBefore(LocalDateTime cutoff);
}
