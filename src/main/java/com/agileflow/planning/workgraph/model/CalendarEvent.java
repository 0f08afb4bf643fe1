package com.agileflow.planning.workgraph.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * Team calendar entry (holiday, offsite, on-call week...) that reduces capacity.
 * TEAM-scoped events apply to every member, MEMBER-scoped ones only to {@code userId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "team_calendar_events")
public class CalendarEvent {

    public static final String STATUS_CANCELLED = "cancelled";

    public enum Scope {
        TEAM,
        MEMBER
    }

    @Id
    private String id;

    @Indexed
    private String teamId;

    private String userId;

    private Scope scope;

    private String title;

    private LocalDateTime startDate;

    private LocalDateTime endDate;

    // Percentage of capacity lost on the overlapping days; null is treated as 100
    private Integer capacityImpact;

    private String status;

    public boolean appliesTo(String memberId) {
        return scope == Scope.TEAM || (userId != null && userId.equals(memberId));
    }
}
