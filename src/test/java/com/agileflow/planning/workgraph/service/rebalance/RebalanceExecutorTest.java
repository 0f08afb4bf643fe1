package com.agileflow.planning.workgraph.service.rebalance;

import com.agileflow.planning.workgraph.dto.rebalance.ApplyRebalanceRequest;
import com.agileflow.planning.workgraph.dto.rebalance.ImbalanceSummary;
import com.agileflow.planning.workgraph.dto.rebalance.MemberRef;
import com.agileflow.planning.workgraph.dto.rebalance.RebalanceMove;
import com.agileflow.planning.workgraph.exception.InvalidRebalancePlanException;
import com.agileflow.planning.workgraph.model.ActivityEvent;
import com.agileflow.planning.workgraph.model.Member;
import com.agileflow.planning.workgraph.model.RebalanceRecord;
import com.agileflow.planning.workgraph.model.WorkItem;
import com.agileflow.planning.workgraph.model.WorkItemType;
import com.agileflow.planning.workgraph.repository.MemberRepository;
import com.agileflow.planning.workgraph.repository.RebalanceRecordRepository;
import com.agileflow.planning.workgraph.repository.WorkItemRepository;
import com.agileflow.planning.workgraph.service.activity.ActivityService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RebalanceExecutorTest {

    @Mock
    private WorkItemRepository workItemRepository;

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private RebalanceRecordRepository rebalanceRecordRepository;

    @Mock
    private ActivityService activityService;

    @InjectMocks
    private RebalanceExecutor executor;

    @Test
    void appliesEveryMove_whenPlanIsStillCurrent() {
        when(workItemRepository.findById("t1")).thenReturn(Optional.of(task("t1", "alice")));
        when(memberRepository.findById("bob")).thenReturn(Optional.of(member("bob", "Bob")));
        when(workItemRepository.reassign(anyString(), anyString(), anyString(), any())).thenReturn(true);
        when(rebalanceRecordRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        RebalanceRecord record = executor.apply("team-1", request(move("t1", "alice", "bob", 5)), "manager");

        assertThat(record.getStatus()).isEqualTo(RebalanceRecord.Status.APPLIED);
        assertThat(record.getSummary().getTotalMoves()).isEqualTo(1);
        assertThat(record.getSummary().getTotalPointsMoved()).isEqualTo(5.0);
        assertThat(record.getSummary().getOverloadedResolved()).isEqualTo(1);
        assertThat(record.getImbalanceScore()).isEqualTo(7.5);
        assertThat(record.getTriggeredBy()).isEqualTo("manager");

        verify(workItemRepository).reassign(eq("t1"), eq("alice"), eq("bob"), any());
        verify(workItemRepository, never()).save(any());

        verify(activityService).record(eq(ActivityEvent.Action.MOVED), eq("task"), eq("t1"), eq("manager"),
                eq("Task \"Task t1\" automatically reassigned to Bob"), anyMap());
        verify(activityService).record(eq(ActivityEvent.Action.REBALANCED), eq("team"), eq("team-1"), eq("manager"),
                anyString(), anyMap());
    }

    @Test
    void staleMoveIsSkipped_andRecordIsPartial() {
        when(workItemRepository.findById("t1")).thenReturn(Optional.of(task("t1", "alice")));
        when(workItemRepository.findById("t2")).thenReturn(Optional.of(task("t2", "carol")));
        when(memberRepository.findById("bob")).thenReturn(Optional.of(member("bob", "Bob")));
        when(workItemRepository.reassign(anyString(), anyString(), anyString(), any())).thenReturn(true);
        when(rebalanceRecordRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        RebalanceRecord record = executor.apply("team-1",
                request(move("t1", "alice", "bob", 5), move("t2", "alice", "bob", 3)), "manager");

        assertThat(record.getStatus()).isEqualTo(RebalanceRecord.Status.PARTIAL);
        assertThat(record.getMoves()).extracting(RebalanceRecord.MoveOutcome::getStatus)
                .containsExactly(RebalanceRecord.MoveOutcome.APPLIED, RebalanceRecord.MoveOutcome.SKIPPED);
        assertThat(record.getMoves().get(1).getFailureReason()).isEqualTo(RebalanceExecutor.ASSIGNMENT_CHANGED);
        assertThat(record.getSummary().getTotalMoves()).isEqualTo(1);
        assertThat(record.getSummary().getTotalPointsMoved()).isEqualTo(5.0);
        verify(workItemRepository, times(1)).reassign(anyString(), anyString(), anyString(), any());
    }

    @Test
    void everyMoveSkipped_marksRecordFailed() {
        when(workItemRepository.findById("gone")).thenReturn(Optional.empty());
        when(workItemRepository.findById("t1")).thenReturn(Optional.of(task("t1", "alice")));
        when(memberRepository.findById("left-company")).thenReturn(Optional.empty());
        when(rebalanceRecordRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        RebalanceRecord record = executor.apply("team-1",
                request(move("gone", "alice", "bob", 2), move("t1", "alice", "left-company", 2)), "manager");

        assertThat(record.getStatus()).isEqualTo(RebalanceRecord.Status.FAILED);
        assertThat(record.getMoves()).extracting(RebalanceRecord.MoveOutcome::getFailureReason)
                .containsExactly(RebalanceExecutor.TASK_NOT_FOUND, RebalanceExecutor.TARGET_NOT_FOUND);
        verify(workItemRepository, never()).reassign(anyString(), any(), anyString(), any());
    }

    @Test
    void failingMoveIsSkippedAndLaterMovesStillRun() {
        when(workItemRepository.findById("t1")).thenThrow(new DataAccessResourceFailureException("connection reset"));
        when(workItemRepository.findById("t2")).thenReturn(Optional.of(task("t2", "alice")));
        when(memberRepository.findById("bob")).thenReturn(Optional.of(member("bob", "Bob")));
        when(workItemRepository.reassign(anyString(), anyString(), anyString(), any())).thenReturn(true);
        when(rebalanceRecordRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        RebalanceRecord record = executor.apply("team-1",
                request(move("t1", "alice", "bob", 4), move("t2", "alice", "bob", 4)), "manager");

        assertThat(record.getStatus()).isEqualTo(RebalanceRecord.Status.PARTIAL);
        assertThat(record.getMoves().get(0).getFailureReason()).isEqualTo("connection reset");
        assertThat(record.getMoves().get(1).isApplied()).isTrue();
    }

    @Test
    void reassignmentThatLosesTheRaceIsSkipped() {
        // t1 still belongs to alice when read, but the conditional write matches nothing
        when(workItemRepository.findById("t1")).thenReturn(Optional.of(task("t1", "alice")));
        when(memberRepository.findById("bob")).thenReturn(Optional.of(member("bob", "Bob")));
        when(workItemRepository.reassign(eq("t1"), eq("alice"), eq("bob"), any())).thenReturn(false);
        when(rebalanceRecordRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        RebalanceRecord record = executor.apply("team-1", request(move("t1", "alice", "bob", 5)), "manager");

        assertThat(record.getStatus()).isEqualTo(RebalanceRecord.Status.FAILED);
        assertThat(record.getMoves().get(0).getFailureReason()).isEqualTo(RebalanceExecutor.ASSIGNMENT_CHANGED);
        assertThat(record.getSummary().getTotalPointsMoved()).isZero();
        verify(workItemRepository, never()).save(any());
        verify(activityService, never()).record(eq(ActivityEvent.Action.MOVED), anyString(), anyString(), anyString(),
                anyString(), anyMap());
    }

    @Test
    void failingAuditEntryDoesNotUndoAnAppliedMove() {
        when(workItemRepository.findById("t1")).thenReturn(Optional.of(task("t1", "alice")));
        when(memberRepository.findById("bob")).thenReturn(Optional.of(member("bob", "Bob")));
        when(workItemRepository.reassign(anyString(), anyString(), anyString(), any())).thenReturn(true);
        when(rebalanceRecordRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
        doThrow(new TaskRejectedException("executor shut down")).when(activityService)
                .record(eq(ActivityEvent.Action.MOVED), anyString(), anyString(), anyString(), anyString(), anyMap());

        RebalanceRecord record = executor.apply("team-1", request(move("t1", "alice", "bob", 5)), "manager");

        assertThat(record.getStatus()).isEqualTo(RebalanceRecord.Status.APPLIED);
        assertThat(record.getMoves().get(0).isApplied()).isTrue();
        assertThat(record.getMoves().get(0).getFailureReason()).isNull();
        assertThat(record.getSummary().getTotalPointsMoved()).isEqualTo(5.0);
    }

    @Test
    void emptyPlanIsRejectedBeforeAnyWrite() {
        ApplyRebalanceRequest empty = ApplyRebalanceRequest.builder().moves(List.of()).build();

        assertThatThrownBy(() -> executor.apply("team-1", empty, "manager"))
                .isInstanceOf(InvalidRebalancePlanException.class)
                .hasMessage("Rebalance plan is empty");
        verifyNoInteractions(workItemRepository, rebalanceRecordRepository, activityService);
    }

    @Test
    void moveWithoutTargetMakesThePlanMalformed() {
        RebalanceMove broken = RebalanceMove.builder().taskId("t1").pointsMoved(3).build();

        assertThatThrownBy(() -> executor.apply("team-1", request(broken), "manager"))
                .isInstanceOf(InvalidRebalancePlanException.class);
        verifyNoInteractions(workItemRepository, rebalanceRecordRepository);
    }

    private static ApplyRebalanceRequest request(RebalanceMove... moves) {
        return ApplyRebalanceRequest.builder()
                .sprintId("sp1")
                .moves(List.of(moves))
                .imbalance(ImbalanceSummary.builder()
                        .score(7.5)
                        .overloadedMembers(List.of(ImbalanceSummary.OverloadedMember.builder()
                                .userId("alice").name("Alice").overload(7.5).utilization(119).build()))
                        .imbalanceDetected(true)
                        .build())
                .build();
    }

    private static RebalanceMove move(String taskId, String from, String to, double points) {
        return RebalanceMove.builder()
                .taskId(taskId)
                .taskTitle("Task " + taskId)
                .pointsMoved(points)
                .from(MemberRef.builder().userId(from).name(from).build())
                .to(MemberRef.builder().userId(to).name(to).build())
                .reason("rebalance")
                .build();
    }

    private static WorkItem task(String id, String assignee) {
        return WorkItem.builder().id(id).type(WorkItemType.TASK).title("Task " + id)
                .status("todo").storyId("s1").assigneeId(assignee).build();
    }

    private static Member member(String id, String name) {
        return Member.builder().id(id).name(name).teamId("team-1").build();
    }
}
