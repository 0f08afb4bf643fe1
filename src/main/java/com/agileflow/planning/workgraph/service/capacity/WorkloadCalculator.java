package com.agileflow.planning.workgraph.service.capacity;

import com.agileflow.planning.workgraph.dto.capacity.WorkloadItem;
import com.agileflow.planning.workgraph.model.WorkItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a member's open assignments into point totals.
 * <p>
 * Stories count their own points, or half their estimated hours (at least 1) when only hours are known. A task counts its parent story's estimate split evenly over the
 * story's open tasks; without an estimated parent it falls back to half its estimated hours (at least 1).
 */
@Component
public class WorkloadCalculator {

    /**
     * @param openAssigned   the member's not-done work items
     * @param storiesById    parent stories of those tasks
     * @param openTaskCounts open task count per story id
     * @param sprintStoryIds when non-null, only work belonging to these stories counts
     */
    public MemberWorkload calculate(List<WorkItem> openAssigned, Map<String, WorkItem> storiesById,
                                    Map<String, Long> openTaskCounts, Set<String> sprintStoryIds) {
        List<WorkloadItem> tasks = new ArrayList<>();
        List<WorkloadItem> stories = new ArrayList<>();
        double total = 0;

        for (WorkItem item : openAssigned) {
            if (item.isDone()) continue;

            if (item.isStory()) {
                if (sprintStoryIds != null && !sprintStoryIds.contains(item.getId())) continue;
                double points = storyPoints(item);
                stories.add(toWorkloadItem(item, item.getStoryPoints(), points));
                total += points;
            } else {
                if (sprintStoryIds != null && (item.getStoryId() == null || !sprintStoryIds.contains(item.getStoryId()))) continue;
                WorkItem story = item.getStoryId() != null ? storiesById.get(item.getStoryId()) : null;
                Double storyPoints = story != null ? story.getStoryPoints() : null;
                long openTasks = story != null ? openTaskCounts.getOrDefault(story.getId(), 1L) : 1L;
                double points = taskPoints(item, storyPoints, openTasks);
                tasks.add(toWorkloadItem(item, storyPoints, points));
                total += points;
            }
        }

        return new MemberWorkload(tasks, stories, CapacityMath.round2(total));
    }

    double taskPoints(WorkItem task, Double parentStoryPoints, long openTasksInStory) {
        if (parentStoryPoints != null && parentStoryPoints > 0) {
            return CapacityMath.round2(parentStoryPoints / Math.max(1, openTasksInStory));
        }
        return hoursPoints(task);
    }

    double storyPoints(WorkItem story) {
        if (story.getStoryPoints() != null && story.getStoryPoints() > 0) {
            return story.getStoryPoints();
        }
        return hoursPoints(story);
    }

    private double hoursPoints(WorkItem item) {
        if (item.getEstimatedHours() != null && item.getEstimatedHours() > 0) {
            return Math.max(1, item.getEstimatedHours() / 2);
        }
        return 0;
    }

    private WorkloadItem toWorkloadItem(WorkItem item, Double storyPoints, double points) {
        return WorkloadItem.builder()
                .id(item.getId())
                .title(item.getTitle())
                .status(item.getStatus())
                .storyId(item.isTask() ? item.getStoryId() : item.getId())
                .storyPoints(storyPoints)
                .estimatedHours(item.getEstimatedHours())
                .points(points)
                .build();
    }
}
