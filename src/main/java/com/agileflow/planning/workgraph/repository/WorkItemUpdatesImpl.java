package com.agileflow.planning.workgraph.repository;

import com.agileflow.planning.workgraph.model.WorkItem;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.LocalDateTime;

import static org.springframework.data.mongodb.core.query.Criteria.where;

@RequiredArgsConstructor
@Slf4j
public class WorkItemUpdatesImpl implements WorkItemUpdates {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean addDependency(String itemId, String dependencyId, LocalDateTime updatedAt) {
        Update update = new Update().addToSet("dependencies", dependencyId).set("updatedAt", updatedAt);
        return matched(byId(itemId), update);
    }

    @Override
    public boolean removeDependency(String itemId, String dependencyId, LocalDateTime updatedAt) {
        Update update = new Update().pull("dependencies", dependencyId).set("updatedAt", updatedAt);
        return matched(byId(itemId), update);
    }

    @Override
    public boolean reassign(String taskId, String expectedAssigneeId, String newAssigneeId, LocalDateTime updatedAt) {
        Criteria criteria = where("_id").is(taskId);
        if (expectedAssigneeId != null) {
            criteria = criteria.and("assigneeId").is(expectedAssigneeId);
        }
        Update update = Update.update("assigneeId", newAssigneeId).set("updatedAt", updatedAt);
        return matched(Query.query(criteria), update);
    }

    private Query byId(String id) {
        return Query.query(where("_id").is(id));
    }

    private boolean matched(Query query, Update update) {
        UpdateResult result = mongoTemplate.updateFirst(query, update, WorkItem.class);
        log.debug("Work item update matched {}, modified {}", result.getMatchedCount(), result.getModifiedCount());
        return result.getMatchedCount() > 0;
    }
}
