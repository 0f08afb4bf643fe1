package com.agileflow.planning.workgraph.dto.rebalance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Team imbalance as measured before any move was simulated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImbalanceSummary {

    private double score;           // sum of overloads, one decimal

    @Builder.Default
    private List<OverloadedMember> overloadedMembers = new ArrayList<>();

    @Builder.Default
    private List<UnderutilizedMember> underutilizedMembers = new ArrayList<>();

    private boolean imbalanceDetected;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OverloadedMember {
        private String userId;
        private String name;
        private double overload;
        private int utilization;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UnderutilizedMember {
        private String userId;
        private String name;
        private double availablePoints;
        private int utilization;
    }
}
