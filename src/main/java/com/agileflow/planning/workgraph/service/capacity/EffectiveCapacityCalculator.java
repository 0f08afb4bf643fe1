package com.agileflow.planning.workgraph.service.capacity;

import com.agileflow.planning.workgraph.model.CalendarEvent;
import com.agileflow.planning.workgraph.model.CapacityAdjustment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Reduces a member's base capacity for leave, holidays and team calendar events inside a planning window.
 */
@Component
@Slf4j
public class EffectiveCapacityCalculator {

    /**
     * Effective capacity of a member over the window.
     * <p>
     * Capacity adjustments are only applied to explicit windows (a sprint or caller supplied dates);
     * calendar events always apply.
     */
    public double calculate(String memberId, double baseCapacity, List<CapacityAdjustment> adjustments,
                            List<CalendarEvent> events, PlanningWindow window) {
        double capacity = window.isExplicit()
                ? applyAdjustments(baseCapacity, adjustments, window.getStart(), window.getEnd())
                : baseCapacity;

        double multiplier = calendarMultiplier(memberId, events, window.getStart(), window.getEnd());
        double effective = Math.max(0, CapacityMath.round2(capacity * multiplier));

        log.debug("Member {}: base {} -> adjusted {} x calendar {} = {}", memberId, baseCapacity, capacity, multiplier, effective);
        return effective;
    }

    /**
     * Base capacity minus the share of window days lost to adjustments.
     * A zero {@code adjustedCapacity} removes the overlapping days entirely, any other value
     * removes them in proportion to the capacity it takes away.
     */
    public double applyAdjustments(double baseCapacity, List<CapacityAdjustment> adjustments,
                                   LocalDateTime windowStart, LocalDateTime windowEnd) {
        if (baseCapacity <= 0) {
            return 0;
        }
        long windowDays = CapacityMath.daysBetween(windowStart, windowEnd);
        if (windowDays == 0 || adjustments == null || adjustments.isEmpty()) {
            return baseCapacity;
        }

        double reducedDays = 0;
        for (CapacityAdjustment adjustment : adjustments) {
            if (adjustment.getStartDate() == null || adjustment.getEndDate() == null) continue;

            long overlap = CapacityMath.overlapDays(adjustment.getStartDate(), adjustment.getEndDate(), windowStart, windowEnd);
            if (overlap == 0) continue;

            if (adjustment.getAdjustedCapacity() == 0) {
                reducedDays += overlap;
            } else {
                reducedDays += overlap * (1 - adjustment.getAdjustedCapacity() / baseCapacity);
            }
        }

        double adjusted = baseCapacity * (1 - reducedDays / windowDays);
        return Math.max(0, CapacityMath.round2(adjusted));
    }

    /**
     * Fraction of the window a member keeps after calendar events, in [0, 1].
     */
    public double calendarMultiplier(String memberId, List<CalendarEvent> events,
                                     LocalDateTime windowStart, LocalDateTime windowEnd) {
        if (events == null || events.isEmpty()) {
            return 1;
        }
        long windowDays = Math.max(1, CapacityMath.daysBetween(windowStart, windowEnd));

        double lost = 0;
        for (CalendarEvent event : events) {
            if (!event.appliesTo(memberId) || CalendarEvent.STATUS_CANCELLED.equals(event.getStatus())) continue;
            if (event.getStartDate() == null || event.getEndDate() == null) continue;

            long overlap = CapacityMath.overlapDays(event.getStartDate(), event.getEndDate(), windowStart, windowEnd);
            int impact = event.getCapacityImpact() != null ? event.getCapacityImpact() : 100;
            lost += (impact / 100.0) * ((double) overlap / windowDays);
        }

        return Math.max(0, 1 - Math.min(1, lost));
    }
}
