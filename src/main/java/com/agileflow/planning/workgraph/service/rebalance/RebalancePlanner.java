package com.agileflow.planning.workgraph.service.rebalance;

import com.agileflow.planning.workgraph.dto.capacity.MemberCapacity;
import com.agileflow.planning.workgraph.dto.capacity.TeamCapacitySnapshot;
import com.agileflow.planning.workgraph.dto.capacity.WorkloadItem;
import com.agileflow.planning.workgraph.dto.rebalance.ImbalanceSummary;
import com.agileflow.planning.workgraph.dto.rebalance.MemberRef;
import com.agileflow.planning.workgraph.dto.rebalance.MoveImpact;
import com.agileflow.planning.workgraph.dto.rebalance.RebalanceMove;
import com.agileflow.planning.workgraph.dto.rebalance.RebalancePlan;
import com.agileflow.planning.workgraph.dto.rebalance.RebalanceSuggestion;
import com.agileflow.planning.workgraph.service.capacity.CapacityMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Greedy planner that moves tasks from overloaded members to underutilized ones.
 * <p>
 * Overloaded members are handled in snapshot order, their tasks biggest first, and each task goes to
 * the member with the most available points at that moment. A task is never split across members.
 * All bookkeeping happens on copies; the snapshot passed in is left untouched.
 */
@Component
@Slf4j
public class RebalancePlanner {

    private final double underutilizationThreshold;
    private final double minAvailablePoints;

    public RebalancePlanner(@Value("${workgraph.rebalance.underutilization-threshold:80}") double underutilizationThreshold,
                            @Value("${workgraph.rebalance.min-available-points:2}") double minAvailablePoints) {
        this.underutilizationThreshold = underutilizationThreshold;
        this.minAvailablePoints = minAvailablePoints;
    }

    public RebalancePlan plan(TeamCapacitySnapshot snapshot, String sprintId) {
        List<Load> overloaded = new ArrayList<>();
        List<Load> underutilized = new ArrayList<>();

        for (MemberCapacity member : snapshot.getMembers()) {
            if (member.isOverloaded()) {
                overloaded.add(new Load(member));
            } else if (member.getUtilization() < underutilizationThreshold && member.getAvailablePoints() > minAvailablePoints) {
                underutilized.add(new Load(member));
            }
        }

        ImbalanceSummary imbalance = summarize(overloaded, underutilized);
        log.info("Team {}: {} overloaded, {} underutilized, imbalance score {}", snapshot.getTeamId(),
                overloaded.size(), underutilized.size(), imbalance.getScore());

        List<RebalanceMove> moves = new ArrayList<>();
        for (Load source : overloaded) {
            planMoves(source, underutilized, moves);
        }

        double totalPointsMoved = CapacityMath.round1(moves.stream().mapToDouble(RebalanceMove::getPointsMoved).sum());

        return RebalancePlan.builder()
                .teamId(snapshot.getTeamId())
                .sprintId(sprintId)
                .moves(moves)
                .totalMoves(moves.size())
                .totalPointsMoved(totalPointsMoved)
                .imbalance(imbalance)
                .suggestions(List.of(suggest(overloaded.size(), underutilized.size(), moves.size(), totalPointsMoved)))
                .capacity(snapshot)
                .generatedAt(LocalDateTime.now())
                .build();
    }

    private void planMoves(Load source, List<Load> targets, List<RebalanceMove> moves) {
        List<WorkloadItem> candidates = new ArrayList<>(source.member.getTasks());
        candidates.sort(Comparator.comparingDouble(this::pointsOf).reversed());

        double remaining = source.workload - source.capacity;
        for (WorkloadItem task : candidates) {
            if (remaining <= 0) break;

            targets.sort(Comparator.comparingDouble((Load load) -> load.available).reversed());
            Load target = targets.stream().filter(t -> t.available > 0).findFirst().orElse(null);
            if (target == null) {
                log.debug("No capacity left to absorb work from {}", source.member.getUserId());
                break;
            }

            double points = pointsOf(task);
            int fromBefore = CapacityMath.utilization(source.workload, source.capacity);
            int toBefore = CapacityMath.utilization(target.workload, target.capacity);

            source.workload = Math.max(0, source.workload - points);
            target.workload += points;
            target.available = Math.max(0, target.available - points);
            remaining -= points;

            moves.add(RebalanceMove.builder()
                    .taskId(task.getId())
                    .taskTitle(task.getTitle())
                    .storyId(task.getStoryId())
                    .pointsMoved(points)
                    .from(source.ref())
                    .to(target.ref())
                    .reason(String.format(Locale.ROOT, "%s is overloaded by %.1f pts while %s has %.1f pts available",
                            source.member.getName(), source.overload, target.member.getName(), target.available))
                    .impact(MoveImpact.builder()
                            .fromBefore(fromBefore)
                            .fromAfter(CapacityMath.utilization(source.workload, source.capacity))
                            .toBefore(toBefore)
                            .toAfter(CapacityMath.utilization(target.workload, target.capacity))
                            .build())
                    .build());
        }
    }

    // Point-equivalent of a task; zero-point work still costs something to move
    private double pointsOf(WorkloadItem task) {
        return task.getPoints() > 0 ? task.getPoints() : 1;
    }

    private ImbalanceSummary summarize(List<Load> overloaded, List<Load> underutilized) {
        double score = 0;
        List<ImbalanceSummary.OverloadedMember> overloadedMembers = new ArrayList<>();
        for (Load load : overloaded) {
            score += load.overload;
            overloadedMembers.add(ImbalanceSummary.OverloadedMember.builder()
                    .userId(load.member.getUserId())
                    .name(load.member.getName())
                    .overload(CapacityMath.round2(load.overload))
                    .utilization(load.member.getUtilization())
                    .build());
        }

        List<ImbalanceSummary.UnderutilizedMember> underutilizedMembers = new ArrayList<>();
        for (Load load : underutilized) {
            underutilizedMembers.add(ImbalanceSummary.UnderutilizedMember.builder()
                    .userId(load.member.getUserId())
                    .name(load.member.getName())
                    .availablePoints(load.member.getAvailablePoints())
                    .utilization(load.member.getUtilization())
                    .build());
        }

        return ImbalanceSummary.builder()
                .score(CapacityMath.round1(score))
                .overloadedMembers(overloadedMembers)
                .underutilizedMembers(underutilizedMembers)
                .imbalanceDetected(!overloaded.isEmpty())
                .build();
    }

    private RebalanceSuggestion suggest(int overloadedCount, int underutilizedCount, int moveCount, double pointsMoved) {
        if (moveCount == 0 && overloadedCount == 0) {
            return RebalanceSuggestion.builder()
                    .type(RebalanceSuggestion.Type.BALANCED)
                    .priority("low")
                    .message("Workload appears balanced across the team.")
                    .build();
        }
        if (moveCount == 0) {
            return RebalanceSuggestion.builder()
                    .type(RebalanceSuggestion.Type.INSUFFICIENT_CAPACITY)
                    .priority("high")
                    .message("Unable to find suitable underutilized members for rebalancing. "
                            + "Consider adjusting capacity or sprint scope.")
                    .build();
        }
        return RebalanceSuggestion.builder()
                .type(RebalanceSuggestion.Type.REBALANCE_PLAN)
                .priority("high")
                .message(String.format("Detected %d overloaded and %d underutilized members.", overloadedCount, underutilizedCount))
                .recommendation(String.format(Locale.ROOT, "Move %d task(s) totaling %.1f pts to restore balance.", moveCount, pointsMoved))
                .build();
    }

    /**
     * Mutable working copy of one member's numbers while moves are simulated.
     */
    private static final class Load {
        private final MemberCapacity member;
        private final double capacity;
        private final double overload;
        private double workload;
        private double available;

        private Load(MemberCapacity member) {
            this.member = member;
            this.capacity = member.getEffectiveCapacity();
            this.workload = member.getCurrentWorkload();
            this.available = member.getAvailablePoints();
            this.overload = Math.max(0, member.getCurrentWorkload() - member.getEffectiveCapacity());
        }

        private MemberRef ref() {
            return MemberRef.builder().userId(member.getUserId()).name(member.getName()).build();
        }
    }
}
