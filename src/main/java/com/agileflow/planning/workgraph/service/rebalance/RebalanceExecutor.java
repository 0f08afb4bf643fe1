package com.agileflow.planning.workgraph.service.rebalance;

import com.agileflow.planning.workgraph.dto.rebalance.ApplyRebalanceRequest;
import com.agileflow.planning.workgraph.dto.rebalance.ImbalanceSummary;
import com.agileflow.planning.workgraph.dto.rebalance.RebalanceMove;
import com.agileflow.planning.workgraph.exception.InvalidRebalancePlanException;
import com.agileflow.planning.workgraph.model.ActivityEvent;
import com.agileflow.planning.workgraph.model.Member;
import com.agileflow.planning.workgraph.model.RebalanceRecord;
import com.agileflow.planning.workgraph.model.WorkItem;
import com.agileflow.planning.workgraph.repository.MemberRepository;
import com.agileflow.planning.workgraph.repository.RebalanceRecordRepository;
import com.agileflow.planning.workgraph.repository.WorkItemRepository;
import com.agileflow.planning.workgraph.service.activity.ActivityService;
import com.agileflow.planning.workgraph.service.capacity.CapacityMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies an accepted rebalance plan one move at a time.
 * <p>
 * Each move re-reads its task and only reassigns it when the task is still held by the member the plan
 * took it from. The reassignment is a conditional write of {@code assigneeId}, so a change that lands
 * between the read and the write also skips the move. Moves that cannot be applied are recorded as skipped and the remaining moves still run;
 * nothing is rolled back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RebalanceExecutor {

    static final String TASK_NOT_FOUND = "Task not found";
    static final String ASSIGNMENT_CHANGED = "Task assignment changed since plan was generated";
    static final String TARGET_NOT_FOUND = "Target user not found";

    private final WorkItemRepository workItemRepository;
    private final MemberRepository memberRepository;
    private final RebalanceRecordRepository rebalanceRecordRepository;
    private final ActivityService activityService;

    public RebalanceRecord apply(String teamId, ApplyRebalanceRequest request, String triggeredBy) {
        List<RebalanceMove> moves = request.getMoves();
        validate(moves);
        log.info("Applying rebalance plan for team {} with {} move(s), triggered by {}", teamId, moves.size(), triggeredBy);

        List<RebalanceRecord.MoveOutcome> outcomes = new ArrayList<>();
        double pointsMoved = 0;
        int applied = 0;

        for (RebalanceMove move : moves) {
            RebalanceRecord.MoveOutcome outcome = applyMove(move, triggeredBy);
            outcomes.add(outcome);
            if (outcome.isApplied()) {
                applied++;
                pointsMoved += move.getPointsMoved();
            }
        }

        int skipped = outcomes.size() - applied;
        ImbalanceSummary imbalance = request.getImbalance() != null ? request.getImbalance() : new ImbalanceSummary();

        RebalanceRecord record = RebalanceRecord.builder()
                .teamId(teamId)
                .sprintId(request.getSprintId())
                .triggeredBy(triggeredBy)
                .imbalanceScore(request.getImbalance() != null ? imbalance.getScore() : null)
                .summary(RebalanceRecord.Summary.builder()
                        .totalMoves(applied)
                        .totalPointsMoved(CapacityMath.round1(pointsMoved))
                        .overloadedResolved(imbalance.getOverloadedMembers() != null ? imbalance.getOverloadedMembers().size() : 0)
                        .manualOverride(request.isManualOverride())
                        .build())
                .moves(outcomes)
                .imbalanceSnapshot(imbalance)
                .status(skipped == 0 ? RebalanceRecord.Status.APPLIED
                        : applied > 0 ? RebalanceRecord.Status.PARTIAL
                        : RebalanceRecord.Status.FAILED)
                .appliedAt(LocalDateTime.now())
                .createdAt(LocalDateTime.now())
                .build();

        RebalanceRecord saved = rebalanceRecordRepository.save(record);
        log.info("Rebalance {} for team {}: {} applied, {} skipped ({})", saved.getId(), teamId, applied, skipped, saved.getStatus());

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("rebalanceId", saved.getId());
        metadata.put("imbalanceScore", saved.getImbalanceScore());
        metadata.put("appliedMoves", applied);
        metadata.put("skippedMoves", skipped);
        activityService.record(ActivityEvent.Action.REBALANCED, "team", teamId, triggeredBy,
                String.format("Workload rebalance applied: %d of %d move(s)", applied, outcomes.size()), metadata);

        return saved;
    }

    private void validate(List<RebalanceMove> moves) {
        if (moves == null || moves.isEmpty()) {
            throw new InvalidRebalancePlanException("Rebalance plan is empty");
        }
        for (RebalanceMove move : moves) {
            if (move == null || move.getTaskId() == null || move.getTo() == null || move.getTo().getUserId() == null) {
                throw new InvalidRebalancePlanException("Every move needs a taskId and a target userId");
            }
        }
    }

    private RebalanceRecord.MoveOutcome applyMove(RebalanceMove move, String triggeredBy) {
        RebalanceRecord.MoveOutcome outcome = RebalanceRecord.MoveOutcome.builder()
                .taskId(move.getTaskId())
                .taskTitle(move.getTaskTitle())
                .from(move.getFrom())
                .to(move.getTo())
                .pointsMoved(move.getPointsMoved())
                .reason(move.getReason())
                .build();

        WorkItem task;
        Member target;
        try {
            Optional<WorkItem> found = workItemRepository.findById(move.getTaskId());
            if (found.isEmpty()) {
                return skip(outcome, TASK_NOT_FOUND);
            }
            task = found.get();

            String expectedAssignee = move.getFrom() != null ? move.getFrom().getUserId() : null;
            if (expectedAssignee != null && !expectedAssignee.equals(task.getAssigneeId())) {
                return skip(outcome, ASSIGNMENT_CHANGED);
            }

            Optional<Member> targetMember = memberRepository.findById(move.getTo().getUserId());
            if (targetMember.isEmpty()) {
                return skip(outcome, TARGET_NOT_FOUND);
            }
            target = targetMember.get();

            // matches nothing when the task was reassigned or deleted after the read above
            if (!workItemRepository.reassign(task.getId(), expectedAssignee, target.getId(), LocalDateTime.now())) {
                return skip(outcome, ASSIGNMENT_CHANGED);
            }
            outcome.setStatus(RebalanceRecord.MoveOutcome.APPLIED);
        } catch (Exception e) {
            log.error("Error applying rebalance move for task {}: {}", move.getTaskId(), e.getMessage(), e);
            return skip(outcome, e.getMessage());
        }

        recordMove(task, target, move, triggeredBy);
        return outcome;
    }

    private void recordMove(WorkItem task, Member target, RebalanceMove move, String triggeredBy) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("oldUserId", task.getAssigneeId());
        metadata.put("newUserId", target.getId());
        metadata.put("reason", move.getReason());
        try {
            activityService.record(ActivityEvent.Action.MOVED, "task", task.getId(), triggeredBy,
                    String.format("Task \"%s\" automatically reassigned to %s", task.getTitle(), target.getName()),
                    metadata);
        } catch (RuntimeException e) {
            // the reassignment is already written; only the audit entry is lost
            log.warn("Could not record reassignment of task {}: {}", task.getId(), e.getMessage());
        }
    }

    private RebalanceRecord.MoveOutcome skip(RebalanceRecord.MoveOutcome outcome, String reason) {
        log.warn("Skipping rebalance move of task {}: {}", outcome.getTaskId(), reason);
        outcome.setStatus(RebalanceRecord.MoveOutcome.SKIPPED);
        outcome.setFailureReason(reason);
        return outcome;
    }
}
