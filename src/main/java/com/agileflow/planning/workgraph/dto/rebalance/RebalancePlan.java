package com.agileflow.planning.workgraph.dto.rebalance;

import com.agileflow.planning.workgraph.dto.capacity.TeamCapacitySnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of proposed moves plus the imbalance metrics and capacity snapshot
 * they were derived from. Nothing is persisted until the plan is applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebalancePlan {

    private String teamId;
    private String sprintId;

    @Builder.Default
    private List<RebalanceMove> moves = new ArrayList<>();

    private int totalMoves;
    private double totalPointsMoved;
    private ImbalanceSummary imbalance;

    @Builder.Default
    private List<RebalanceSuggestion> suggestions = new ArrayList<>();

    private TeamCapacitySnapshot capacity;
    private LocalDateTime generatedAt;
}
