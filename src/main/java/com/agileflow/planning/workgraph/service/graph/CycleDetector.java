package com.agileflow.planning.workgraph.service.graph;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Cycle checks over work item dependencies.
 * <p>
 * {@link #wouldCreateCycle} guards every dependency insertion. {@link #findCycles} scans an
 * already built graph and only reports something when dependency lists were written without
 * going through the guard.
 */
@Component
@Slf4j
public class CycleDetector {

    /**
     * Whether making {@code itemId} depend on {@code dependencyId} would close a loop.
     * <p>
     * Walks the dependency chain of {@code dependencyId} with an explicit stack; the loop exists
     * when {@code itemId} is reached. Only the nodes reachable from {@code dependencyId} are ever
     * looked up.
     *
     * @param dependencyLookup returns the dependency ids of an item, empty for unknown items
     * @param itemId           the item that would gain the dependency
     * @param dependencyId     the item it would depend on
     */
    public boolean wouldCreateCycle(Function<String, List<String>> dependencyLookup,
                                    String itemId, String dependencyId) {
        if (itemId.equals(dependencyId)) {
            return true;
        }

        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(dependencyId);

        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(itemId)) {
                log.debug("Dependency {} -> {} would close a cycle after {} visited node(s)",
                        dependencyId, itemId, visited.size());
                return true;
            }
            if (!visited.add(current)) {
                continue;
            }

            List<String> dependencies = dependencyLookup.apply(current);
            if (dependencies == null) continue;
            for (String next : dependencies) {
                if (next != null && !visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        return false;
    }

    /**
     * Same check against an in-memory graph. Ids outside the graph are leaves.
     */
    public boolean wouldCreateCycle(DependencyGraph graph, String itemId, String dependencyId) {
        return wouldCreateCycle(graph::dependenciesOf, itemId, dependencyId);
    }

    /**
     * Find the distinct cycles of a graph. Each cycle lists its nodes in dependency order
     * and repeats the first node at the end.
     */
    public List<List<String>> findCycles(DependencyGraph graph) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();
        Map<String, String> parent = new HashMap<>();
        Set<String> reported = new HashSet<>();

        for (String node : graph.getNodes().keySet()) {
            if (!visited.contains(node)) {
                dfs(node, graph, visited, inStack, parent, cycles, reported);
            }
        }

        if (!cycles.isEmpty()) {
            log.warn("Found {} dependency cycle(s) in {} scope {}", cycles.size(),
                    graph.getScope().getType(), graph.getScope().getId());
        }
        return cycles;
    }

    private void dfs(String node, DependencyGraph graph,
                     Set<String> visited, Set<String> inStack,
                     Map<String, String> parent,
                     List<List<String>> cycles, Set<String> reported) {
        visited.add(node);
        inStack.add(node);

        for (String dependent : graph.dependentsOf(node)) {
            if (!visited.contains(dependent)) {
                parent.put(dependent, node);
                dfs(dependent, graph, visited, inStack, parent, cycles, reported);
            } else if (inStack.contains(dependent)) {
                List<String> cycle = reconstructCycle(dependent, node, parent);
                if (reported.add(normalizeCycleKey(cycle))) {
                    cycles.add(cycle);
                }
            }
        }

        inStack.remove(node);
    }

    private List<String> reconstructCycle(String start, String end, Map<String, String> parent) {
        List<String> cycle = new ArrayList<>();
        cycle.add(end);

        String current = end;
        while (!current.equals(start)) {
            current = parent.getOrDefault(current, start);
            cycle.add(current);
        }

        Collections.reverse(cycle);
        cycle.add(start);
        return cycle;
    }

    // Rotate so the smallest id comes first; the same loop found from another entry point maps to one key
    private String normalizeCycleKey(List<String> cycle) {
        List<String> core = cycle.subList(0, cycle.size() - 1);
        int minIdx = core.indexOf(Collections.min(core));
        List<String> normalized = new ArrayList<>(core.size());
        for (int i = 0; i < core.size(); i++) {
            normalized.add(core.get((minIdx + i) % core.size()));
        }
        return normalized.toString();
    }
}
