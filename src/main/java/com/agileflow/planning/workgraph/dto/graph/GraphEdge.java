package com.agileflow.planning.workgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed edge from a dependency ({@code source}) to the item that depends on it ({@code target}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdge {

    private String source;
    private String target;
    private boolean critical;
}
