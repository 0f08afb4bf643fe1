package com.agileflow.planning.workgraph.service.graph;

import com.agileflow.planning.workgraph.model.WorkItem;
import com.agileflow.planning.workgraph.model.WorkItemType;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * The set of work items a dependency graph is built over.
 * STORY scopes hold the tasks of one story, PROJECT scopes the stories of one project.
 */
@Data
@AllArgsConstructor
public class GraphScope {

    public enum Type {
        STORY(WorkItemType.TASK),
        PROJECT(WorkItemType.STORY);

        private final WorkItemType memberType;

        Type(WorkItemType memberType) {
            this.memberType = memberType;
        }

        public WorkItemType getMemberType() {
            return memberType;
        }
    }

    private final Type type;
    private final String id;

    public static GraphScope story(String storyId) {
        return new GraphScope(Type.STORY, storyId);
    }

    public static GraphScope project(String projectId) {
        return new GraphScope(Type.PROJECT, projectId);
    }

    /**
     * Scope a work item belongs to: a task lives in its story's graph, a story in its project's graph.
     */
    public static GraphScope of(WorkItem item) {
        return switch (item.getType()) {
            case TASK -> story(item.getStoryId());
            case STORY -> project(item.getProjectId());
        };
    }

    /**
     * Whether {@code item} can take part in this scope's graph.
     */
    public boolean contains(WorkItem item) {
        if (item.getType() != type.getMemberType() || id == null) {
            return false;
        }
        return switch (type) {
            case STORY -> id.equals(item.getStoryId());
            case PROJECT -> id.equals(item.getProjectId());
        };
    }
}
