package com.agileflow.planning.workgraph.controller;

import com.agileflow.planning.workgraph.dto.capacity.CapacityTrend;
import com.agileflow.planning.workgraph.dto.capacity.TeamCapacitySnapshot;
import com.agileflow.planning.workgraph.dto.rebalance.ApplyRebalanceRequest;
import com.agileflow.planning.workgraph.dto.rebalance.RebalancePlan;
import com.agileflow.planning.workgraph.model.RebalanceRecord;
import com.agileflow.planning.workgraph.service.capacity.CapacitySnapshotService;
import com.agileflow.planning.workgraph.service.rebalance.RebalanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Team capacity view and workload rebalancing.
 */
@RestController
@RequestMapping("/api/teams/{teamId}")
@RequiredArgsConstructor
@Slf4j
public class TeamWorkloadController {

    private final CapacitySnapshotService capacitySnapshotService;
    private final RebalanceService rebalanceService;

    @GetMapping("/capacity")
    public ResponseEntity<TeamCapacitySnapshot> getCapacity(
            @PathVariable String teamId,
            @RequestParam(required = false) String sprintId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end) {
        return ResponseEntity.ok(capacitySnapshotService.getTeamCapacity(teamId, sprintId, start, end));
    }

    @GetMapping("/capacity-trends")
    public ResponseEntity<List<CapacityTrend>> getCapacityTrends(
            @PathVariable String teamId,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(capacitySnapshotService.getCapacityTrends(teamId, limit));
    }

    @GetMapping("/rebalance-suggestions")
    public ResponseEntity<RebalancePlan> getRebalanceSuggestions(
            @PathVariable String teamId,
            @RequestParam(required = false) String sprintId) {
        log.info("Generating rebalance suggestions for team: {}", teamId);
        return ResponseEntity.ok(rebalanceService.generatePlan(teamId, sprintId));
    }

    /**
     * Apply a (possibly edited) plan. Individual moves may be skipped; the returned record says which.
     */
    @PostMapping("/rebalance/apply")
    public ResponseEntity<RebalanceRecord> applyRebalance(
            @PathVariable String teamId,
            @RequestBody ApplyRebalanceRequest request) {
        String username = getAuthenticatedUsername();
        log.info("Applying rebalance plan for team: {} by {}", teamId, username);
        return ResponseEntity.ok(rebalanceService.applyPlan(teamId, request, username));
    }

    @GetMapping("/rebalance/history")
    public ResponseEntity<List<RebalanceRecord>> getRebalanceHistory(
            @PathVariable String teamId,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(rebalanceService.getHistory(teamId, limit));
    }

    private String getAuthenticatedUsername() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        return authentication != null ? authentication.getName() : null;
    }
}
