package com.agileflow.planning.workgraph.model;

/**
 * Kind of work item stored in the {@code work_items} collection.
 * Tasks are scoped by their parent story, stories by their project.
 */
public enum WorkItemType {
    TASK,
    STORY
}
