package com.agileflow.planning.workgraph.model;

import com.agileflow.planning.workgraph.dto.rebalance.ImbalanceSummary;
import com.agileflow.planning.workgraph.dto.rebalance.MemberRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB document recording one application of a rebalance plan.
 * Written once by the executor and never updated afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "workload_rebalances")
@CompoundIndex(name = "team_created_idx", def = "{'teamId': 1, 'createdAt': -1}")
public class RebalanceRecord {

    @Id
    private String id;

    private String teamId;

    private String sprintId;

    private String triggeredBy;

    private Double imbalanceScore;

    private Summary summary;

    @Builder.Default
    private List<MoveOutcome> moves = new ArrayList<>();

    private ImbalanceSummary imbalanceSnapshot;

    private String status;          // applied, partial, failed

    private LocalDateTime appliedAt;

    private LocalDateTime createdAt;

    public static class Status {
        public static final String APPLIED = "applied";
        public static final String PARTIAL = "partial";
        public static final String FAILED = "failed";
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int totalMoves;             // applied moves only
        private double totalPointsMoved;
        private int overloadedResolved;
        private boolean manualOverride;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MoveOutcome {

        public static final String APPLIED = "applied";
        public static final String SKIPPED = "skipped";

        private String taskId;
        private String taskTitle;
        private MemberRef from;
        private MemberRef to;
        private double pointsMoved;
        private String reason;
        private String status;
        private String failureReason;

        public boolean isApplied() {
            return APPLIED.equals(status);
        }
    }
}
