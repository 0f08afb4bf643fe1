package com.agileflow.planning.workgraph.service.capacity;

import com.agileflow.planning.workgraph.model.Sprint;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Time range a capacity snapshot is computed for.
 * {@code explicit} is false only for the rolling default window used when neither dates nor a sprint are known.
 */
@Getter
@AllArgsConstructor
public class PlanningWindow {

    private final LocalDateTime start;
    private final LocalDateTime end;
    private final boolean explicit;
    private final Sprint sprint;
}
