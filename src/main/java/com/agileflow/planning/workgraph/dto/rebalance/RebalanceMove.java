package com.agileflow.planning.workgraph.dto.rebalance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A proposed reassignment of one task from an overloaded member to an underutilized one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebalanceMove {

    private String taskId;
    private String taskTitle;
    private String storyId;
    private double pointsMoved;
    private MemberRef from;
    private MemberRef to;
    private String reason;
    private MoveImpact impact;
}
