package com.agileflow.planning.workgraph.repository;

import com.agileflow.planning.workgraph.model.Sprint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SprintRepository extends MongoRepository<Sprint, String> {

    // Most recently started sprint with the given status among a team's projects
    Optional<Sprint> findFirstByProjectIdInAndStatusOrderByStartDateDesc(Collection<String> projectIds, String status);

    List<Sprint> findByProjectIdInAndStatusOrderByEndDateDesc(Collection<String> projectIds, String status, Pageable pageable);
}
