package com.agileflow.planning.workgraph.service.capacity;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Rounding and day arithmetic shared by the capacity and rebalance calculations.
 */
public final class CapacityMath {

    private static final double MILLIS_PER_DAY = 24 * 60 * 60 * 1000d;

    private CapacityMath() {
    }

    public static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    public static double round1(double value) {
        return Math.round(value * 10) / 10.0;
    }

    // Integer percent of workload against capacity, 0 when there is no capacity
    public static int utilization(double workload, double capacity) {
        return capacity > 0 ? (int) Math.round(workload / capacity * 100) : 0;
    }

    /**
     * Whole days between two instants, rounded up. Negative ranges give 0.
     */
    public static long daysBetween(LocalDateTime start, LocalDateTime end) {
        long millis = Duration.between(start, end).toMillis();
        return Math.max(0, (long) Math.ceil(millis / MILLIS_PER_DAY));
    }

    /**
     * Days of {@code [start, end]} that fall inside {@code [windowStart, windowEnd]}, rounded up.
     */
    public static long overlapDays(LocalDateTime start, LocalDateTime end,
                                   LocalDateTime windowStart, LocalDateTime windowEnd) {
        LocalDateTime overlapStart = start.isAfter(windowStart) ? start : windowStart;
        LocalDateTime overlapEnd = end.isBefore(windowEnd) ? end : windowEnd;
        return daysBetween(overlapStart, overlapEnd);
    }
}
