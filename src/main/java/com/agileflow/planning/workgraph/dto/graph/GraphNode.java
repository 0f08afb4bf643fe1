package com.agileflow.planning.workgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Node of a dependency graph view. Compatible with D3.js and Cytoscape.js layouts,
 * which use {@code level} as the layer index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private String id;
    private String label;
    private String type;            // TASK, STORY
    private String status;
    private String priority;
    private LocalDateTime dueDate;
    private int dependencyCount;
    private boolean blocked;
    private boolean critical;       // on the critical path
    private boolean current;        // the item the graph was requested for
    private int level;
}
