package com.agileflow.planning.workgraph.dto.rebalance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Utilization percentages of both members before and after a move.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MoveImpact {

    private int fromBefore;
    private int fromAfter;
    private int toBefore;
    private int toAfter;
}
