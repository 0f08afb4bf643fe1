package com.agileflow.planning.workgraph.repository;

import com.agileflow.planning.workgraph.model.Team;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TeamRepository extends MongoRepository<Team, String> {
}
