package com.agileflow.planning.workgraph.service.capacity;

import com.agileflow.planning.workgraph.model.CalendarEvent;
import com.agileflow.planning.workgraph.model.CapacityAdjustment;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EffectiveCapacityCalculatorTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 3, 1, 0, 0);
    private static final LocalDateTime END = START.plusDays(10);

    private final EffectiveCapacityCalculator calculator = new EffectiveCapacityCalculator();

    @Test
    void leaveCoveringHalfTheWindowHalvesCapacity() {
        CapacityAdjustment leave = adjustment(START, START.plusDays(5), 0);

        double effective = calculator.calculate("m1", 40, List.of(leave), List.of(), window(true));

        assertThat(effective).isEqualTo(20.0);
    }

    @Test
    void partialAdjustmentReducesInProportion() {
        // 4 days at 20 of 40 points = 2 reduced days out of 10
        CapacityAdjustment reduced = adjustment(START, START.plusDays(4), 20);

        assertThat(calculator.applyAdjustments(40, List.of(reduced), START, END)).isEqualTo(32.0);
    }

    @Test
    void adjustmentOutsideTheWindowIsIgnored() {
        CapacityAdjustment before = adjustment(START.minusDays(20), START.minusDays(15), 0);

        assertThat(calculator.applyAdjustments(40, List.of(before), START, END)).isEqualTo(40.0);
    }

    @Test
    void adjustmentsAreSkippedForTheRollingDefaultWindow() {
        CapacityAdjustment leave = adjustment(START, START.plusDays(5), 0);

        assertThat(calculator.calculate("m1", 40, List.of(leave), List.of(), window(false))).isEqualTo(40.0);
    }

    @Test
    void leaveLongerThanTheWindowFloorsAtZero() {
        CapacityAdjustment leave = adjustment(START.minusDays(3), END.plusDays(3), 0);

        assertThat(calculator.applyAdjustments(40, List.of(leave), START, END)).isZero();
    }

    @Test
    void zeroBaseCapacityStaysZero() {
        CapacityAdjustment reduced = adjustment(START, START.plusDays(4), 20);

        assertThat(calculator.applyAdjustments(0, List.of(reduced), START, END)).isZero();
    }

    @Test
    void teamEventAppliesToEveryMember() {
        // 2 of 10 days at 50%
        CalendarEvent offsite = event(CalendarEvent.Scope.TEAM, null, START, START.plusDays(2), 50);

        assertThat(calculator.calendarMultiplier("m1", List.of(offsite), START, END)).isEqualTo(0.9);
        assertThat(calculator.calculate("m1", 40, List.of(), List.of(offsite), window(true))).isEqualTo(36.0);
    }

    @Test
    void memberEventOnlyAppliesToThatMember() {
        CalendarEvent onCall = event(CalendarEvent.Scope.MEMBER, "m2", START, START.plusDays(5), null);

        assertThat(calculator.calendarMultiplier("m1", List.of(onCall), START, END)).isEqualTo(1.0);
        assertThat(calculator.calendarMultiplier("m2", List.of(onCall), START, END)).isEqualTo(0.5);
    }

    @Test
    void calendarLossIsCappedAtTheWholeWindow() {
        CalendarEvent first = event(CalendarEvent.Scope.TEAM, null, START, END, 100);
        CalendarEvent second = event(CalendarEvent.Scope.TEAM, null, START, END, 100);

        assertThat(calculator.calendarMultiplier("m1", List.of(first, second), START, END)).isZero();
    }

    @Test
    void cancelledEventsAreIgnored() {
        CalendarEvent cancelled = event(CalendarEvent.Scope.TEAM, null, START, END, 100);
        cancelled.setStatus(CalendarEvent.STATUS_CANCELLED);

        assertThat(calculator.calendarMultiplier("m1", List.of(cancelled), START, END)).isEqualTo(1.0);
    }

    private static PlanningWindow window(boolean explicit) {
        return new PlanningWindow(START, END, explicit, null);
    }

    private static CapacityAdjustment adjustment(LocalDateTime start, LocalDateTime end, double adjustedCapacity) {
        return CapacityAdjustment.builder()
                .type(CapacityAdjustment.Type.LEAVE)
                .startDate(start)
                .endDate(end)
                .adjustedCapacity(adjustedCapacity)
                .build();
    }

    private static CalendarEvent event(CalendarEvent.Scope scope, String userId,
                                       LocalDateTime start, LocalDateTime end, Integer impact) {
        return CalendarEvent.builder()
                .teamId("t1")
                .scope(scope)
                .userId(userId)
                .title("event")
                .startDate(start)
                .endDate(end)
                .capacityImpact(impact)
                .status("confirmed")
                .build();
    }
}
