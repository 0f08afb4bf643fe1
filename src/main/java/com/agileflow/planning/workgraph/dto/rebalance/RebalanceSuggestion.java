package com.agileflow.planning.workgraph.dto.rebalance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebalanceSuggestion {

    private String type;            // balanced, insufficient_capacity, rebalance_plan
    private String priority;        // low, high
    private String message;
    private String recommendation;

    public static class Type {
        public static final String BALANCED = "balanced";
        public static final String INSUFFICIENT_CAPACITY = "insufficient_capacity";
        public static final String REBALANCE_PLAN = "rebalance_plan";
    }
}
