package com.agileflow.planning.workgraph.controller;

import com.agileflow.planning.workgraph.dto.graph.DependencyGraphResponse;
import com.agileflow.planning.workgraph.service.graph.DependencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects/{projectId}")
@RequiredArgsConstructor
@Slf4j
public class ProjectGraphController {

    private final DependencyService dependencyService;

    /**
     * Story-level dependency graph of a project.
     */
    @GetMapping("/dependency-graph")
    public ResponseEntity<DependencyGraphResponse> getProjectDependencyGraph(@PathVariable String projectId) {
        log.info("Getting story dependency graph for project: {}", projectId);
        return ResponseEntity.ok(dependencyService.getProjectDependencyGraph(projectId));
    }
}
