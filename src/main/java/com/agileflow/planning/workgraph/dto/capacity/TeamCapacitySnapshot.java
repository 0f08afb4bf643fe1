package com.agileflow.planning.workgraph.dto.capacity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Capacity and workload of every member of a team over a planning window.
 * Members appear in the team's member order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamCapacitySnapshot {

    private String teamId;
    private String teamName;
    private LocalDateTime windowStart;
    private LocalDateTime windowEnd;
    private SprintSummary sprint;
    private List<MemberCapacity> members;
    private Totals totals;
    private Warnings warnings;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Totals {
        private double totalCapacity;
        private double totalWorkload;
        private int totalUtilization;
        private double sprintCommitment;
        private double availableCapacity;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Warnings {
        private boolean teamOverloaded;
        private List<MemberOverload> overloadedMembers;
        private boolean capacityExceeded;   // sprint commitment above team capacity
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MemberOverload {
        private String userId;
        private String name;
        private double overload;
    }
}
