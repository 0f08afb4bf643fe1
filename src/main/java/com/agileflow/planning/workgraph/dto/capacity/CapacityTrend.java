package com.agileflow.planning.workgraph.dto.capacity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Capacity against commitment for one completed sprint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapacityTrend {

    private String sprintId;
    private String sprintName;
    private LocalDateTime startDate;
    private LocalDateTime endDate;
    private double capacity;
    private double committed;
    private double completed;
    private double velocity;
    private int utilization;
}
