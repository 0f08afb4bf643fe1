package com.agileflow.planning.workgraph.dto.capacity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SprintSummary {

    private String id;
    private String name;
    private LocalDateTime startDate;
    private LocalDateTime endDate;
    private double committedPoints;
}
