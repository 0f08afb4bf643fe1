package com.agileflow.planning.workgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "members")
public class Member {

    @Id
    private String id;

    private String name;

    private String email;

    @Indexed
    private String teamId;

    // Base capacity in story points per sprint; null means "use the configured default"
    private Double availability;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private List<CapacityAdjustment> capacityAdjustments = new ArrayList<>();
}
