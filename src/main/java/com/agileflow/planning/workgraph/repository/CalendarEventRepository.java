package com.agileflow.planning.workgraph.repository;

import com.agileflow.planning.workgraph.model.CalendarEvent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface CalendarEventRepository extends MongoRepository<CalendarEvent, String> {

    /**
     * Non-cancelled events of a team overlapping [windowStart, windowEnd].
     */
    @Query("{ 'teamId': ?0, 'startDate': { $lte: ?2 }, 'endDate': { $gte: ?1 }, 'status': { $ne: 'cancelled' } }")
    List<CalendarEvent> findOverlapping(String teamId, LocalDateTime windowStart, LocalDateTime windowEnd);
}
