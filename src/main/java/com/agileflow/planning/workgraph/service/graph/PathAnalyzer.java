package com.agileflow.planning.workgraph.service.graph;

import com.agileflow.planning.workgraph.dto.graph.BlockedItem;
import com.agileflow.planning.workgraph.model.WorkItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Critical path, topological levels and blocked items of a dependency graph.
 * <p>
 * Uses Kahn's algorithm with longest-path relaxation. The critical path ends at the first node,
 * in the order distances were first assigned, that holds the maximum distance; ties between
 * equally long branches are therefore settled by node load order.
 */
@Component
@Slf4j
public class PathAnalyzer {

    public PathAnalysis analyze(DependencyGraph graph) {
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : graph.getNodes().keySet()) {
            inDegree.put(id, graph.dependenciesOf(id).size());
        }

        Queue<String> queue = new ArrayDeque<>();
        // insertion order = order in which a node was first reached
        Map<String, Integer> distances = new LinkedHashMap<>();
        Map<String, String> predecessors = new HashMap<>();

        for (String id : graph.getNodes().keySet()) {
            if (inDegree.get(id) == 0) {
                queue.add(id);
                distances.put(id, 0);
            }
        }

        Set<String> ordered = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            ordered.add(current);
            int currentDistance = distances.getOrDefault(current, 0);

            for (String neighbor : graph.dependentsOf(current)) {
                int candidate = currentDistance + 1;
                if (candidate > distances.getOrDefault(neighbor, 0)) {
                    distances.put(neighbor, candidate);
                    predecessors.put(neighbor, current);
                }

                int remaining = inDegree.merge(neighbor, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(neighbor);
                }
            }
        }

        Set<String> unordered = new LinkedHashSet<>(graph.getNodes().keySet());
        unordered.removeAll(ordered);
        if (!unordered.isEmpty()) {
            log.warn("{} node(s) in {} scope {} sit on a dependency cycle and were left unordered: {}",
                    unordered.size(), graph.getScope().getType(), graph.getScope().getId(), unordered);
        }

        List<String> criticalPath = criticalPath(distances, predecessors, ordered);

        Map<String, Integer> levels = new LinkedHashMap<>();
        for (String id : graph.getNodes().keySet()) {
            levels.put(id, ordered.contains(id) ? distances.getOrDefault(id, 0) : 0);
        }

        return PathAnalysis.builder()
                .criticalPath(criticalPath)
                .levels(levels)
                .blockedItems(findBlockedItems(graph))
                .unordered(unordered)
                .build();
    }

    private List<String> criticalPath(Map<String, Integer> distances,
                                      Map<String, String> predecessors,
                                      Set<String> ordered) {
        int maxDistance = -1;
        String endNode = null;
        for (Map.Entry<String, Integer> entry : distances.entrySet()) {
            if (ordered.contains(entry.getKey()) && entry.getValue() > maxDistance) {
                maxDistance = entry.getValue();
                endNode = entry.getKey();
            }
        }

        LinkedList<String> path = new LinkedList<>();
        String pointer = endNode;
        while (pointer != null) {
            path.addFirst(pointer);
            pointer = predecessors.get(pointer);
        }
        return new ArrayList<>(path);
    }

    /**
     * An item is blocked when at least one of its direct in-scope dependencies is not done.
     */
    private List<BlockedItem> findBlockedItems(DependencyGraph graph) {
        List<BlockedItem> blocked = new ArrayList<>();
        for (WorkItem item : graph.getNodes().values()) {
            List<String> unmet = graph.dependenciesOf(item.getId()).stream()
                    .filter(depId -> !graph.node(depId).isDone())
                    .toList();
            if (!unmet.isEmpty()) {
                blocked.add(BlockedItem.builder()
                        .id(item.getId())
                        .title(item.getTitle())
                        .status(item.getStatus())
                        .unmetDependencies(unmet)
                        .build());
            }
        }
        return blocked;
    }
}
