package com.agileflow.planning.workgraph.controller;

import com.agileflow.planning.workgraph.dto.graph.AddDependencyRequest;
import com.agileflow.planning.workgraph.dto.graph.DependencyGraphResponse;
import com.agileflow.planning.workgraph.dto.graph.ImpactResponse;
import com.agileflow.planning.workgraph.dto.graph.WorkItemDependencies;
import com.agileflow.planning.workgraph.service.graph.DependencyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.*;

/**
 * Dependency edges of a single work item and the graph of the scope it belongs to.
 */
@RestController
@RequestMapping("/api/work-items/{itemId}/dependencies")
@RequiredArgsConstructor
@Slf4j
public class WorkItemDependencyController {

    private final DependencyService dependencyService;

    @PostMapping
    public ResponseEntity<WorkItemDependencies> addDependency(
            @PathVariable String itemId,
            @Valid @RequestBody AddDependencyRequest request) {
        log.info("Add dependency request: {} -> {}", itemId, request.getDependencyId());
        WorkItemDependencies response = dependencyService.addDependency(itemId, request.getDependencyId(), getAuthenticatedUsername());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{dependencyId}")
    public ResponseEntity<WorkItemDependencies> removeDependency(
            @PathVariable String itemId,
            @PathVariable String dependencyId) {
        log.info("Remove dependency request: {} -> {}", itemId, dependencyId);
        return ResponseEntity.ok(dependencyService.removeDependency(itemId, dependencyId, getAuthenticatedUsername()));
    }

    /**
     * Graph of the item's story (for tasks) or project (for stories).
     */
    @GetMapping("/graph")
    public ResponseEntity<DependencyGraphResponse> getDependencyGraph(@PathVariable String itemId) {
        return ResponseEntity.ok(dependencyService.getDependencyGraph(itemId));
    }

    @GetMapping("/impact")
    public ResponseEntity<ImpactResponse> getImpact(@PathVariable String itemId) {
        return ResponseEntity.ok(dependencyService.getImpact(itemId));
    }

    private String getAuthenticatedUsername() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        return authentication != null ? authentication.getName() : null;
    }
}
