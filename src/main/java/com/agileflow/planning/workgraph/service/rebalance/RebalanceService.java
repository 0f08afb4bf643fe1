package com.agileflow.planning.workgraph.service.rebalance;

import com.agileflow.planning.workgraph.dto.capacity.TeamCapacitySnapshot;
import com.agileflow.planning.workgraph.dto.rebalance.ApplyRebalanceRequest;
import com.agileflow.planning.workgraph.dto.rebalance.RebalancePlan;
import com.agileflow.planning.workgraph.exception.ResourceNotFoundException;
import com.agileflow.planning.workgraph.model.RebalanceRecord;
import com.agileflow.planning.workgraph.repository.RebalanceRecordRepository;
import com.agileflow.planning.workgraph.repository.TeamRepository;
import com.agileflow.planning.workgraph.service.capacity.CapacitySnapshotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class RebalanceService {

    private final CapacitySnapshotService capacitySnapshotService;
    private final RebalancePlanner rebalancePlanner;
    private final RebalanceExecutor rebalanceExecutor;
    private final TeamRepository teamRepository;
    private final RebalanceRecordRepository rebalanceRecordRepository;

    /**
     * Propose moves for the team's current workload. Nothing is written.
     */
    public RebalancePlan generatePlan(String teamId, String sprintId) {
        TeamCapacitySnapshot snapshot = capacitySnapshotService.getTeamCapacity(teamId, sprintId, null, null);
        RebalancePlan plan = rebalancePlanner.plan(snapshot, sprintId);
        log.info("Generated rebalance plan for team {}: {} move(s), {} pts", teamId, plan.getTotalMoves(), plan.getTotalPointsMoved());
        return plan;
    }

    public RebalanceRecord applyPlan(String teamId, ApplyRebalanceRequest request, String triggeredBy) {
        if (!teamRepository.existsById(teamId)) {
            throw ResourceNotFoundException.of("Team", teamId);
        }
        return rebalanceExecutor.apply(teamId, request, triggeredBy);
    }

    public List<RebalanceRecord> getHistory(String teamId, int limit) {
        if (!teamRepository.existsById(teamId)) {
            throw ResourceNotFoundException.of("Team", teamId);
        }
        return rebalanceRecordRepository.findByTeamIdOrderByCreatedAtDesc(teamId, PageRequest.of(0, Math.max(1, limit)));
    }
}
