package com.agileflow.planning.workgraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlockedItem {

    private String id;
    private String title;
    private String status;
    private List<String> unmetDependencies;   // direct dependencies that are not done
}
