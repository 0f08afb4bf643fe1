package com.agileflow.planning.workgraph.service.graph;

import com.agileflow.planning.workgraph.model.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds adjacency maps over the work items of a scope.
 * <p>
 * Dependency ids that do not resolve to an item of the scope are dropped: items are deleted
 * independently of the items that reference them, and a deleted dependency counts as satisfied.
 */
@Component
@Slf4j
public class DependencyGraphBuilder {

    public DependencyGraph build(GraphScope scope, List<WorkItem> items) {
        Map<String, WorkItem> nodes = new LinkedHashMap<>();
        Map<String, List<String>> forward = new LinkedHashMap<>();
        Map<String, List<String>> reverse = new LinkedHashMap<>();

        for (WorkItem item : items) {
            if (item.getId() == null || nodes.containsKey(item.getId())) {
                continue;
            }
            nodes.put(item.getId(), item);
            forward.put(item.getId(), new ArrayList<>());
            reverse.put(item.getId(), new ArrayList<>());
        }

        int dropped = 0;
        for (WorkItem item : nodes.values()) {
            if (item.getDependencies() == null) continue;

            Set<String> seen = new LinkedHashSet<>();
            for (String dependencyId : item.getDependencies()) {
                if (dependencyId == null || !seen.add(dependencyId)) continue;
                if (!nodes.containsKey(dependencyId)) {
                    dropped++;
                    continue;
                }
                forward.get(dependencyId).add(item.getId());
                reverse.get(item.getId()).add(dependencyId);
            }
        }

        if (dropped > 0) {
            log.debug("Ignored {} dangling dependency reference(s) in {} scope {}", dropped, scope.getType(), scope.getId());
        }
        return new DependencyGraph(scope, nodes, forward, reverse);
    }
}
