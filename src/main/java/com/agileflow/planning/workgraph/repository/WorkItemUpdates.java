package com.agileflow.planning.workgraph.repository;

import java.time.LocalDateTime;

/**
 * Single-field writes on work items. The CRUD platform owns every other field of a work item,
 * so these never replace the whole document.
 */
public interface WorkItemUpdates {

    /**
     * @return false when no work item with {@code itemId} exists
     */
    boolean addDependency(String itemId, String dependencyId, LocalDateTime updatedAt);

    boolean removeDependency(String itemId, String dependencyId, LocalDateTime updatedAt);

    /**
     * Reassigns a task only while it is still held by {@code expectedAssigneeId}.
     * A null expected assignee reassigns unconditionally.
     *
     * @return false when the task is gone or its assignee no longer matches
     */
    boolean reassign(String taskId, String expectedAssigneeId, String newAssigneeId, LocalDateTime updatedAt);
}
