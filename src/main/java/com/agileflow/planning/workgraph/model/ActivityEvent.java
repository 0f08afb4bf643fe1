package com.agileflow.planning.workgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Audit trail entry emitted after dependency changes and rebalance moves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "activity_events")
@CompoundIndex(name = "entity_idx", def = "{'entityType': 1, 'entityId': 1}")
public class ActivityEvent {

    @Id
    private String id;

    private String action;          // updated, moved, rebalanced

    private String entityType;      // task, story, team

    private String entityId;

    private String userId;

    private String description;

    private Map<String, Object> metadata;

    @Indexed
    private LocalDateTime createdAt;

    public static class Action {
        public static final String UPDATED = "updated";
        public static final String MOVED = "moved";
        public static final String REBALANCED = "rebalanced";
    }
}
