package com.agileflow.planning.workgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Sprint as stored by the CRUD platform. Read only here: it supplies the planning window
 * and the set of stories whose work counts towards sprint-scoped workload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "sprints")
public class Sprint {

    @Id
    private String id;

    @Indexed
    private String projectId;

    private String name;

    private String status;          // planned, active, completed

    private LocalDateTime startDate;

    private LocalDateTime endDate;

    @Builder.Default
    private List<String> storyIds = new ArrayList<>();

    private Double committedPoints;

    private Double completedPoints;

    private Double velocity;

    public static class Status {
        public static final String PLANNED = "planned";
        public static final String ACTIVE = "active";
        public static final String COMPLETED = "completed";
    }
}
