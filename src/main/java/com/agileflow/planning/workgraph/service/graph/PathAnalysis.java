package com.agileflow.planning.workgraph.service.graph;

import com.agileflow.planning.workgraph.dto.graph.BlockedItem;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of {@link PathAnalyzer#analyze(DependencyGraph)}.
 */
@Getter
@Builder
public class PathAnalysis {

    private final List<String> criticalPath;
    private final Map<String, Integer> levels;
    private final List<BlockedItem> blockedItems;

    // Nodes the topological pass could not order; empty unless a cycle bypassed the insertion guard
    private final Set<String> unordered;

    public boolean isCritical(String id) {
        return criticalPath.contains(id);
    }
}
