package com.agileflow.planning.workgraph.dto.graph;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddDependencyRequest {

    @NotBlank(message = "dependencyId is required")
    private String dependencyId;
}
