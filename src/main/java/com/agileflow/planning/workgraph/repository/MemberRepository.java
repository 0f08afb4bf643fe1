package com.agileflow.planning.workgraph.repository;

import com.agileflow.planning.workgraph.model.Member;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MemberRepository extends MongoRepository<Member, String> {
}
