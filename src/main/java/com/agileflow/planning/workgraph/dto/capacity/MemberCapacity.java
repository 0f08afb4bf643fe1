package com.agileflow.planning.workgraph.dto.capacity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Capacity snapshot of one team member for a planning window.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemberCapacity {

    private String userId;
    private String name;
    private String email;
    private double baseCapacity;
    private double effectiveCapacity;
    private double currentWorkload;
    private int utilization;        // percent, rounded
    private double availablePoints;
    private boolean overloaded;

    @Builder.Default
    private List<WorkloadItem> tasks = new ArrayList<>();

    @Builder.Default
    private List<WorkloadItem> stories = new ArrayList<>();

    private int taskCount;
    private int storyCount;
}
