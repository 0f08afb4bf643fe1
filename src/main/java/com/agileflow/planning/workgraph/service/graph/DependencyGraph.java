package com.agileflow.planning.workgraph.service.graph;

import com.agileflow.planning.workgraph.model.WorkItem;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * In-memory dependency graph of one scope, indexed by work item id.
 * <p>
 * {@code forward} maps a dependency to the items that depend on it, {@code reverse} maps an item
 * to its in-scope dependencies. Both only reference ids present in {@code nodes}, and all three
 * maps iterate in node load order. Instances are built per request and never shared.
 */
@Getter
public class DependencyGraph {

    private final GraphScope scope;
    private final Map<String, WorkItem> nodes;
    private final Map<String, List<String>> forward;
    private final Map<String, List<String>> reverse;

    DependencyGraph(GraphScope scope,
                    Map<String, WorkItem> nodes,
                    Map<String, List<String>> forward,
                    Map<String, List<String>> reverse) {
        this.scope = scope;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.forward = Collections.unmodifiableMap(forward);
        this.reverse = Collections.unmodifiableMap(reverse);
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public WorkItem node(String id) {
        return nodes.get(id);
    }

    public List<String> dependentsOf(String id) {
        return forward.getOrDefault(id, List.of());
    }

    public List<String> dependenciesOf(String id) {
        return reverse.getOrDefault(id, List.of());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
