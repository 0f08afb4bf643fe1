package com.agileflow.planning.workgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Upstream blockers and downstream impacted items of a single work item.
 * {@code impactScore} is the number of impacted items, not a weighted score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactResponse {

    private String itemId;
    private String scopeType;
    private String scopeId;
    private List<ItemSummary> blockers;
    private List<ItemSummary> impacted;
    private int impactScore;
}
