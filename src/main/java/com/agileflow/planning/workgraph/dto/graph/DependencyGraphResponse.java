package com.agileflow.planning.workgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Dependency graph of one scope (the tasks of a story or the stories of a project)
 * together with its critical path and blocked items.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyGraphResponse {

    private String scopeType;       // STORY, PROJECT
    private String scopeId;
    private List<GraphNode> nodes;
    private List<GraphEdge> edges;
    private List<String> criticalPath;
    private Map<String, Integer> levels;
    private List<BlockedItem> blockedItems;
    private List<List<String>> cycles;  // empty unless stored dependencies already loop
    private GraphStats stats;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GraphStats {
        private int totalItems;
        private int blockedItems;
        private int criticalCount;
    }
}
