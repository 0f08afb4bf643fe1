package com.agileflow.planning.workgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB document for a task or a story.
 * Written by the CRUD platform; this service only mutates {@code dependencies} and {@code assigneeId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "work_items")
public class WorkItem {

    public static final String STATUS_DONE = "done";

    @Id
    private String id;

    private WorkItemType type;

    private String title;

    private String status;          // todo, backlog, ready, in-progress, review, done

    private String priority;        // high, medium, low

    @Indexed
    private String projectId;       // stories only

    @Indexed
    private String storyId;         // parent story, tasks only

    // Ids of the items this one depends on (must complete first)
    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    private Double storyPoints;

    private Double estimatedHours;

    @Indexed
    private String assigneeId;

    private LocalDateTime dueDate;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isDone() {
        return STATUS_DONE.equals(status);
    }

    public boolean isTask() {
        return type == WorkItemType.TASK;
    }

    public boolean isStory() {
        return type == WorkItemType.STORY;
    }
}
