package com.agileflow.planning.workgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Time-bounded change to a member's availability, embedded in {@link Member}.
 * An {@code adjustedCapacity} of 0 means the member is fully unavailable for the range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapacityAdjustment {

    public enum Type {
        LEAVE,
        HOLIDAY,
        TRAINING,
        OTHER
    }

    private Type type;
    private LocalDateTime startDate;
    private LocalDateTime endDate;
    private double adjustedCapacity;
    private String reason;
}
