package com.agileflow.planning.workgraph.repository;

import com.agileflow.planning.workgraph.model.WorkItem;
import com.agileflow.planning.workgraph.model.WorkItemType;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface WorkItemRepository extends MongoRepository<WorkItem, String>, WorkItemUpdates {

    // Graph scopes: tasks of a story, stories of a project
    List<WorkItem> findByTypeAndStoryIdOrderByIdAsc(WorkItemType type, String storyId);

    List<WorkItem> findByTypeAndProjectIdOrderByIdAsc(WorkItemType type, String projectId);

    // Workload queries
    List<WorkItem> findByAssigneeIdAndStatusNot(String assigneeId, String status);

    List<WorkItem> findByTypeAndStoryIdInAndStatusNot(WorkItemType type, Collection<String> storyIds, String status);
}
