package com.agileflow.planning.workgraph.dto.capacity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Open work item assigned to a member, with the points it contributes to that member's workload.
 * For tasks {@code points} is the parent story's estimate shared across its open tasks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkloadItem {

    private String id;
    private String title;
    private String status;
    private String storyId;
    private Double storyPoints;     // the story's own estimate (parent story for tasks)
    private Double estimatedHours;
    private double points;
}
