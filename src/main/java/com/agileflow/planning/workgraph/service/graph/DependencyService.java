package com.agileflow.planning.workgraph.service.graph;

import com.agileflow.planning.workgraph.dto.graph.DependencyGraphResponse;
import com.agileflow.planning.workgraph.dto.graph.GraphEdge;
import com.agileflow.planning.workgraph.dto.graph.GraphNode;
import com.agileflow.planning.workgraph.dto.graph.ImpactResponse;
import com.agileflow.planning.workgraph.dto.graph.WorkItemDependencies;
import com.agileflow.planning.workgraph.exception.CircularDependencyException;
import com.agileflow.planning.workgraph.exception.InvalidDependencyException;
import com.agileflow.planning.workgraph.exception.ResourceNotFoundException;
import com.agileflow.planning.workgraph.model.ActivityEvent;
import com.agileflow.planning.workgraph.model.WorkItem;
import com.agileflow.planning.workgraph.repository.WorkItemRepository;
import com.agileflow.planning.workgraph.service.activity.ActivityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for dependency mutations and dependency graph queries.
 * <p>
 * Graphs are rebuilt from the store on every call. The only write path for dependency lists is
 * {@link #addDependency}/{@link #removeDependency}, and every insertion is checked for cycles
 * before it is written. Writes touch the dependency list and {@code updatedAt} only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DependencyService {

    private final WorkItemRepository workItemRepository;
    private final DependencyGraphBuilder graphBuilder;
    private final CycleDetector cycleDetector;
    private final PathAnalyzer pathAnalyzer;
    private final ImpactAnalyzer impactAnalyzer;
    private final ActivityService activityService;

    public WorkItemDependencies addDependency(String itemId, String dependencyId, String username) {
        log.info("Adding dependency {} to work item {}", dependencyId, itemId);

        WorkItem item = findItem(itemId, "Work item");
        WorkItem dependency = findItem(dependencyId, "Dependency work item");

        if (!GraphScope.of(item).contains(dependency)) {
            throw new InvalidDependencyException(item.isTask()
                    ? "Dependencies must belong to the same story"
                    : "Dependencies must belong to the same project");
        }
        if (item.getDependencies().contains(dependencyId)) {
            throw new InvalidDependencyException("Dependency already exists for this work item");
        }
        if (cycleDetector.wouldCreateCycle(this::dependenciesOf, itemId, dependencyId)) {
            throw new CircularDependencyException(itemId, dependencyId);
        }

        if (!workItemRepository.addDependency(itemId, dependencyId, LocalDateTime.now())) {
            throw ResourceNotFoundException.of("Work item", itemId);
        }
        WorkItem updated = findItem(itemId, "Work item");
        log.info("Work item {} now depends on {} ({} dependencies)", itemId, dependencyId, updated.getDependencies().size());

        activityService.record(ActivityEvent.Action.UPDATED, entityType(updated), updated.getId(), username,
                String.format("Added dependency \"%s\" to %s \"%s\"", dependency.getTitle(), entityType(updated), updated.getTitle()),
                Map.of("dependencyAdded", dependencyId));

        return toDependencies(updated);
    }

    public WorkItemDependencies removeDependency(String itemId, String dependencyId, String username) {
        log.info("Removing dependency {} from work item {}", dependencyId, itemId);

        WorkItem item = findItem(itemId, "Work item");
        if (!item.getDependencies().contains(dependencyId)) {
            throw new InvalidDependencyException("Dependency not found on work item");
        }

        if (!workItemRepository.removeDependency(itemId, dependencyId, LocalDateTime.now())) {
            throw ResourceNotFoundException.of("Work item", itemId);
        }
        WorkItem updated = findItem(itemId, "Work item");

        // the dependency itself may already be deleted; only its title is lost then
        String dependencyTitle = workItemRepository.findById(dependencyId).map(WorkItem::getTitle).orElse(dependencyId);
        activityService.record(ActivityEvent.Action.UPDATED, entityType(updated), updated.getId(), username,
                String.format("Removed dependency \"%s\" from %s \"%s\"", dependencyTitle, entityType(updated), updated.getTitle()),
                Map.of("dependencyRemoved", dependencyId));

        return toDependencies(updated);
    }

    /**
     * Graph of the scope the item belongs to, with the item flagged as current.
     */
    public DependencyGraphResponse getDependencyGraph(String itemId) {
        WorkItem item = findItem(itemId, "Work item");
        return buildResponse(loadGraph(GraphScope.of(item)), itemId);
    }

    public DependencyGraphResponse getProjectDependencyGraph(String projectId) {
        return buildResponse(loadGraph(GraphScope.project(projectId)), null);
    }

    public ImpactResponse getImpact(String itemId) {
        WorkItem item = findItem(itemId, "Work item");
        DependencyGraph graph = loadGraph(GraphScope.of(item));

        ImpactResponse impact = impactAnalyzer.analyze(graph, itemId);
        log.info("Impact of {}: {} blocker(s), {} impacted item(s)", itemId,
                impact.getBlockers().size(), impact.getImpactScore());
        return impact;
    }

    DependencyGraph loadGraph(GraphScope scope) {
        List<WorkItem> items = switch (scope.getType()) {
            case STORY -> workItemRepository.findByTypeAndStoryIdOrderByIdAsc(scope.getType().getMemberType(), scope.getId());
            case PROJECT -> workItemRepository.findByTypeAndProjectIdOrderByIdAsc(scope.getType().getMemberType(), scope.getId());
        };
        log.debug("Loaded {} work item(s) for {} scope {}", items.size(), scope.getType(), scope.getId());
        return graphBuilder.build(scope, items);
    }

    private DependencyGraphResponse buildResponse(DependencyGraph graph, String currentId) {
        PathAnalysis analysis = pathAnalyzer.analyze(graph);
        // Only non-empty when dependency lists were written around addDependency
        List<List<String>> cycles = analysis.getUnordered().isEmpty()
                ? List.of()
                : cycleDetector.findCycles(graph);

        List<GraphNode> nodes = new ArrayList<>();
        for (WorkItem item : graph.getNodes().values()) {
            nodes.add(GraphNode.builder()
                    .id(item.getId())
                    .label(item.getTitle())
                    .type(item.getType().name())
                    .status(item.getStatus())
                    .priority(item.getPriority())
                    .dueDate(item.getDueDate())
                    .dependencyCount(item.getDependencies() == null ? 0 : item.getDependencies().size())
                    .blocked(!graph.dependenciesOf(item.getId()).stream().allMatch(id -> graph.node(id).isDone()))
                    .critical(analysis.isCritical(item.getId()))
                    .current(item.getId().equals(currentId))
                    .level(analysis.getLevels().get(item.getId()))
                    .build());
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (String target : graph.getNodes().keySet()) {
            for (String source : graph.dependenciesOf(target)) {
                edges.add(GraphEdge.builder()
                        .source(source)
                        .target(target)
                        .critical(analysis.isCritical(source) && analysis.isCritical(target))
                        .build());
            }
        }

        log.info("Built dependency graph for {} scope {}: {} node(s), {} edge(s), critical path length {}, {} blocked",
                graph.getScope().getType(), graph.getScope().getId(), nodes.size(), edges.size(),
                analysis.getCriticalPath().size(), analysis.getBlockedItems().size());

        return DependencyGraphResponse.builder()
                .scopeType(graph.getScope().getType().name())
                .scopeId(graph.getScope().getId())
                .nodes(nodes)
                .edges(edges)
                .criticalPath(analysis.getCriticalPath())
                .levels(analysis.getLevels())
                .blockedItems(analysis.getBlockedItems())
                .cycles(cycles)
                .stats(DependencyGraphResponse.GraphStats.builder()
                        .totalItems(nodes.size())
                        .blockedItems(analysis.getBlockedItems().size())
                        .criticalCount(analysis.getCriticalPath().size())
                        .build())
                .build();
    }

    private List<String> dependenciesOf(String id) {
        return workItemRepository.findById(id)
                .map(WorkItem::getDependencies)
                .orElse(List.of());
    }

    private WorkItem findItem(String id, String label) {
        WorkItem item = workItemRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.of(label, id));
        if (item.getDependencies() == null) {
            item.setDependencies(new ArrayList<>());
        }
        return item;
    }

    private String entityType(WorkItem item) {
        return item.isTask() ? "task" : "story";
    }

    private WorkItemDependencies toDependencies(WorkItem item) {
        return WorkItemDependencies.builder()
                .id(item.getId())
                .title(item.getTitle())
                .type(item.getType().name())
                .dependencies(List.copyOf(item.getDependencies()))
                .updatedAt(item.getUpdatedAt())
                .build();
    }
}
