package com.agileflow.planning.workgraph.service.capacity;

import com.agileflow.planning.workgraph.dto.capacity.CapacityTrend;
import com.agileflow.planning.workgraph.dto.capacity.MemberCapacity;
import com.agileflow.planning.workgraph.dto.capacity.SprintSummary;
import com.agileflow.planning.workgraph.dto.capacity.TeamCapacitySnapshot;
import com.agileflow.planning.workgraph.exception.ResourceNotFoundException;
import com.agileflow.planning.workgraph.model.CalendarEvent;
import com.agileflow.planning.workgraph.model.Member;
import com.agileflow.planning.workgraph.model.Project;
import com.agileflow.planning.workgraph.model.Sprint;
import com.agileflow.planning.workgraph.model.Team;
import com.agileflow.planning.workgraph.model.WorkItem;
import com.agileflow.planning.workgraph.model.WorkItemType;
import com.agileflow.planning.workgraph.repository.CalendarEventRepository;
import com.agileflow.planning.workgraph.repository.MemberRepository;
import com.agileflow.planning.workgraph.repository.ProjectRepository;
import com.agileflow.planning.workgraph.repository.SprintRepository;
import com.agileflow.planning.workgraph.repository.TeamRepository;
import com.agileflow.planning.workgraph.repository.WorkItemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the per-member capacity and workload view of a team.
 * Snapshots are computed on demand and never stored.
 */
@Service
@Slf4j
public class CapacitySnapshotService {

    private final TeamRepository teamRepository;
    private final MemberRepository memberRepository;
    private final ProjectRepository projectRepository;
    private final SprintRepository sprintRepository;
    private final CalendarEventRepository calendarEventRepository;
    private final WorkItemRepository workItemRepository;
    private final EffectiveCapacityCalculator capacityCalculator;
    private final WorkloadCalculator workloadCalculator;
    private final double defaultBaseCapacity;
    private final int defaultWindowDays;

    public CapacitySnapshotService(TeamRepository teamRepository,
                                   MemberRepository memberRepository,
                                   ProjectRepository projectRepository,
                                   SprintRepository sprintRepository,
                                   CalendarEventRepository calendarEventRepository,
                                   WorkItemRepository workItemRepository,
                                   EffectiveCapacityCalculator capacityCalculator,
                                   WorkloadCalculator workloadCalculator,
                                   @Value("${workgraph.capacity.default-base-capacity:40}") double defaultBaseCapacity,
                                   @Value("${workgraph.capacity.default-window-days:14}") int defaultWindowDays) {
        this.teamRepository = teamRepository;
        this.memberRepository = memberRepository;
        this.projectRepository = projectRepository;
        this.sprintRepository = sprintRepository;
        this.calendarEventRepository = calendarEventRepository;
        this.workItemRepository = workItemRepository;
        this.capacityCalculator = capacityCalculator;
        this.workloadCalculator = workloadCalculator;
        this.defaultBaseCapacity = defaultBaseCapacity;
        this.defaultWindowDays = defaultWindowDays;
    }

    /**
     * Capacity snapshot of a team.
     *
     * @param sprintId optional; restricts workload to the sprint's stories and supplies the window
     * @param start    optional window start, used together with {@code end}
     * @param end      optional window end
     */
    public TeamCapacitySnapshot getTeamCapacity(String teamId, String sprintId, LocalDateTime start, LocalDateTime end) {
        log.info("Computing capacity snapshot for team {} (sprint={}, start={}, end={})", teamId, sprintId, start, end);

        Team team = teamRepository.findById(teamId)
                .orElseThrow(() -> ResourceNotFoundException.of("Team", teamId));

        Sprint requestedSprint = null;
        if (sprintId != null && !sprintId.isBlank()) {
            requestedSprint = sprintRepository.findById(sprintId)
                    .orElseThrow(() -> ResourceNotFoundException.of("Sprint", sprintId));
        }

        PlanningWindow window = resolveWindow(team, requestedSprint, start, end);
        Set<String> sprintStoryIds = requestedSprint != null ? new HashSet<>(requestedSprint.getStoryIds()) : null;

        List<Member> members = loadMembers(team);
        List<CalendarEvent> events = calendarEventRepository.findOverlapping(teamId, window.getStart(), window.getEnd());

        // Open assignments of every member, then one batch for the parent stories and their open task counts
        Map<String, List<WorkItem>> assignments = new LinkedHashMap<>();
        Set<String> parentStoryIds = new HashSet<>();
        for (Member member : members) {
            List<WorkItem> open = workItemRepository.findByAssigneeIdAndStatusNot(member.getId(), WorkItem.STATUS_DONE);
            assignments.put(member.getId(), open);
            open.stream()
                    .filter(WorkItem::isTask)
                    .map(WorkItem::getStoryId)
                    .filter(Objects::nonNull)
                    .forEach(parentStoryIds::add);
        }

        Map<String, WorkItem> storiesById = new LinkedHashMap<>();
        Map<String, Long> openTaskCounts = Map.of();
        if (!parentStoryIds.isEmpty()) {
            workItemRepository.findAllById(parentStoryIds).forEach(story -> storiesById.put(story.getId(), story));
            openTaskCounts = workItemRepository
                    .findByTypeAndStoryIdInAndStatusNot(WorkItemType.TASK, parentStoryIds, WorkItem.STATUS_DONE)
                    .stream()
                    .collect(Collectors.groupingBy(WorkItem::getStoryId, Collectors.counting()));
        }

        List<MemberCapacity> capacities = new ArrayList<>();
        for (Member member : members) {
            double base = member.getAvailability() != null ? member.getAvailability() : defaultBaseCapacity;
            double effective = capacityCalculator.calculate(member.getId(), base, member.getCapacityAdjustments(), events, window);
            MemberWorkload workload = workloadCalculator.calculate(
                    assignments.get(member.getId()), storiesById, openTaskCounts, sprintStoryIds);

            capacities.add(toMemberCapacity(member, base, effective, workload));
        }

        TeamCapacitySnapshot snapshot = TeamCapacitySnapshot.builder()
                .teamId(team.getId())
                .teamName(team.getName())
                .windowStart(window.getStart())
                .windowEnd(window.getEnd())
                .sprint(toSprintSummary(window.getSprint()))
                .members(capacities)
                .build();
        summarize(snapshot, window.getSprint());

        log.info("Capacity snapshot for team {}: {} member(s), capacity {}, workload {}, {} overloaded",
                teamId, capacities.size(), snapshot.getTotals().getTotalCapacity(),
                snapshot.getTotals().getTotalWorkload(), snapshot.getWarnings().getOverloadedMembers().size());
        return snapshot;
    }

    /**
     * Capacity against commitment for the team's last {@code limit} completed sprints, oldest first.
     * Capacity is the current base capacity of the active members; past adjustments and calendar
     * events are not replayed.
     */
    public List<CapacityTrend> getCapacityTrends(String teamId, int limit) {
        Team team = teamRepository.findById(teamId)
                .orElseThrow(() -> ResourceNotFoundException.of("Team", teamId));

        List<String> projectIds = projectIdsOf(team);
        if (projectIds.isEmpty()) {
            return List.of();
        }
        List<Sprint> sprints = sprintRepository.findByProjectIdInAndStatusOrderByEndDateDesc(
                projectIds, Sprint.Status.COMPLETED, PageRequest.of(0, Math.max(1, limit)));

        double capacity = CapacityMath.round2(loadMembers(team).stream()
                .mapToDouble(member -> member.getAvailability() != null ? member.getAvailability() : defaultBaseCapacity)
                .sum());

        List<CapacityTrend> trends = new ArrayList<>();
        for (Sprint sprint : sprints) {
            double committed = orZero(sprint.getCommittedPoints());
            trends.add(CapacityTrend.builder()
                    .sprintId(sprint.getId())
                    .sprintName(sprint.getName())
                    .startDate(sprint.getStartDate())
                    .endDate(sprint.getEndDate())
                    .capacity(capacity)
                    .committed(committed)
                    .completed(orZero(sprint.getCompletedPoints()))
                    .velocity(orZero(sprint.getVelocity()))
                    .utilization(CapacityMath.utilization(committed, capacity))
                    .build());
        }
        Collections.reverse(trends);

        log.info("Capacity trends for team {}: {} completed sprint(s), capacity {}", teamId, trends.size(), capacity);
        return trends;
    }

    /**
     * Window precedence: caller dates, requested sprint, the team's latest active sprint, then a rolling default.
     */
    PlanningWindow resolveWindow(Team team, Sprint requestedSprint, LocalDateTime start, LocalDateTime end) {
        Sprint sprint = requestedSprint != null ? requestedSprint : findActiveSprint(team).orElse(null);

        if (start != null && end != null) {
            return new PlanningWindow(start, end, true, sprint);
        }
        if (sprint != null && sprint.getStartDate() != null && sprint.getEndDate() != null) {
            return new PlanningWindow(sprint.getStartDate(), sprint.getEndDate(), true, sprint);
        }

        LocalDateTime now = LocalDateTime.now();
        return new PlanningWindow(now, now.plusDays(defaultWindowDays), false, sprint);
    }

    private Optional<Sprint> findActiveSprint(Team team) {
        List<String> projectIds = projectIdsOf(team);
        if (projectIds.isEmpty()) {
            return Optional.empty();
        }
        return sprintRepository.findFirstByProjectIdInAndStatusOrderByStartDateDesc(projectIds, Sprint.Status.ACTIVE);
    }

    private List<String> projectIdsOf(Team team) {
        return projectRepository.findByTeamId(team.getId()).stream()
                .map(Project::getId)
                .toList();
    }

    private double orZero(Double value) {
        return value != null ? value : 0;
    }

    // Active members in the team's own order
    private List<Member> loadMembers(Team team) {
        if (team.getMemberIds() == null || team.getMemberIds().isEmpty()) {
            return List.of();
        }
        Map<String, Member> byId = memberRepository.findAllById(team.getMemberIds()).stream()
                .collect(Collectors.toMap(Member::getId, Function.identity(), (a, b) -> a));

        List<Member> ordered = new ArrayList<>();
        for (String memberId : team.getMemberIds()) {
            Member member = byId.get(memberId);
            if (member == null) {
                log.debug("Team {} references unknown member {}", team.getId(), memberId);
                continue;
            }
            if (member.isActive()) {
                ordered.add(member);
            }
        }
        return ordered;
    }

    private MemberCapacity toMemberCapacity(Member member, double base, double effective, MemberWorkload workload) {
        double current = workload.getTotal();
        return MemberCapacity.builder()
                .userId(member.getId())
                .name(member.getName())
                .email(member.getEmail())
                .baseCapacity(base)
                .effectiveCapacity(effective)
                .currentWorkload(current)
                .utilization(CapacityMath.utilization(current, effective))
                .availablePoints(CapacityMath.round2(Math.max(0, effective - current)))
                .overloaded(current > effective)
                .tasks(workload.getTasks())
                .stories(workload.getStories())
                .taskCount(workload.getTasks().size())
                .storyCount(workload.getStories().size())
                .build();
    }

    private void summarize(TeamCapacitySnapshot snapshot, Sprint sprint) {
        double totalCapacity = 0;
        double totalWorkload = 0;
        List<TeamCapacitySnapshot.MemberOverload> overloaded = new ArrayList<>();

        for (MemberCapacity member : snapshot.getMembers()) {
            totalCapacity += member.getEffectiveCapacity();
            totalWorkload += member.getCurrentWorkload();
            if (member.isOverloaded()) {
                overloaded.add(TeamCapacitySnapshot.MemberOverload.builder()
                        .userId(member.getUserId())
                        .name(member.getName())
                        .overload(CapacityMath.round2(member.getCurrentWorkload() - member.getEffectiveCapacity()))
                        .build());
            }
        }
        totalCapacity = CapacityMath.round2(totalCapacity);
        totalWorkload = CapacityMath.round2(totalWorkload);
        double commitment = sprint != null && sprint.getCommittedPoints() != null ? sprint.getCommittedPoints() : 0;

        snapshot.setTotals(TeamCapacitySnapshot.Totals.builder()
                .totalCapacity(totalCapacity)
                .totalWorkload(totalWorkload)
                .totalUtilization(CapacityMath.utilization(totalWorkload, totalCapacity))
                .sprintCommitment(commitment)
                .availableCapacity(CapacityMath.round2(Math.max(0, totalCapacity - totalWorkload)))
                .build());
        snapshot.setWarnings(TeamCapacitySnapshot.Warnings.builder()
                .teamOverloaded(totalWorkload > totalCapacity)
                .overloadedMembers(overloaded)
                .capacityExceeded(commitment > totalCapacity)
                .build());
    }

    private SprintSummary toSprintSummary(Sprint sprint) {
        if (sprint == null) {
            return null;
        }
        return SprintSummary.builder()
                .id(sprint.getId())
                .name(sprint.getName())
                .startDate(sprint.getStartDate())
                .endDate(sprint.getEndDate())
                .committedPoints(sprint.getCommittedPoints() != null ? sprint.getCommittedPoints() : 0)
                .build();
    }
}
