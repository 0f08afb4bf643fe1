package com.agileflow.planning.workgraph.service.graph;

import com.agileflow.planning.workgraph.dto.graph.ImpactResponse;
import com.agileflow.planning.workgraph.dto.graph.ItemSummary;
import com.agileflow.planning.workgraph.model.WorkItem;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

/**
 * Upstream and downstream reach of a single work item.
 */
@Component
public class ImpactAnalyzer {

    public ImpactResponse analyze(DependencyGraph graph, String itemId) {
        List<ItemSummary> blockers = new ArrayList<>();
        List<ItemSummary> impacted = new ArrayList<>();

        if (graph.contains(itemId)) {
            Set<String> upstreamVisited = new HashSet<>();
            upstreamVisited.add(itemId);
            collectBlockers(graph, itemId, upstreamVisited, blockers);

            collectImpacted(graph, itemId, impacted);
        }

        return ImpactResponse.builder()
                .itemId(itemId)
                .scopeType(graph.getScope().getType().name())
                .scopeId(graph.getScope().getId())
                .blockers(blockers)
                .impacted(impacted)
                .impactScore(impacted.size())
                .build();
    }

    // Depth-first over reverse edges: everything this item transitively waits on
    private void collectBlockers(DependencyGraph graph, String current, Set<String> visited, List<ItemSummary> out) {
        for (String dependencyId : graph.dependenciesOf(current)) {
            if (visited.add(dependencyId)) {
                out.add(summarize(graph.node(dependencyId)));
                collectBlockers(graph, dependencyId, visited, out);
            }
        }
    }

    // Breadth-first over forward edges: everything that transitively waits on this item
    private void collectImpacted(DependencyGraph graph, String origin, List<ItemSummary> out) {
        Set<String> visited = new HashSet<>();
        visited.add(origin);
        Queue<String> queue = new ArrayDeque<>();
        queue.add(origin);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dependentId : graph.dependentsOf(current)) {
                if (visited.add(dependentId)) {
                    queue.add(dependentId);
                    out.add(summarize(graph.node(dependentId)));
                }
            }
        }
    }

    private ItemSummary summarize(WorkItem item) {
        return ItemSummary.builder()
                .id(item.getId())
                .title(item.getTitle())
                .status(item.getStatus())
                .build();
    }
}
