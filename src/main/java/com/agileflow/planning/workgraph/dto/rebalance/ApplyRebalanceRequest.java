package com.agileflow.planning.workgraph.dto.rebalance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Plan accepted by a manager. The moves may have been edited client side,
 * in which case {@code manualOverride} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplyRebalanceRequest {

    private String sprintId;

    @Builder.Default
    private List<RebalanceMove> moves = new ArrayList<>();

    private boolean manualOverride;

    private ImbalanceSummary imbalance;
}
