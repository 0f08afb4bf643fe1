package com.agileflow.planning.workgraph.repository;

import com.agileflow.planning.workgraph.model.Project;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ProjectRepository extends MongoRepository<Project, String> {

    List<Project> findByTeamId(String teamId);
}
