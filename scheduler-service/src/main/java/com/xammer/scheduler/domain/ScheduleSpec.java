package com.xammer.scheduler.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Parsed form of a schedule tag value. Built fresh from the tag on every evaluation pass.
 */
public final class ScheduleSpec {

    private final DaySelector days;
    private final TimeBoundary start;
    private final TimeBoundary stop;
    private final EvaluationResult fixedResult;

    private ScheduleSpec(DaySelector days, TimeBoundary start, TimeBoundary stop, EvaluationResult fixedResult) {
        this.days = Objects.requireNonNull(days, "days");
        this.start = Objects.requireNonNull(start, "start");
        this.stop = Objects.requireNonNull(stop, "stop");
        this.fixedResult = fixedResult;
    }

    public static ScheduleSpec of(DaySelector days, TimeBoundary start, TimeBoundary stop) {
        return new ScheduleSpec(days, start, stop, null);
    }

    /**
     * A spec whose decision does not depend on the clock ({@code 24x7}, {@code never},
     * {@code demo-only}).
     */
    public static ScheduleSpec fixed(DaySelector days, TimeBoundary start, TimeBoundary stop,
                                     EvaluationResult result) {
        return new ScheduleSpec(days, start, stop, Objects.requireNonNull(result, "result"));
    }

    public DaySelector getDays() {
        return days;
    }

    public TimeBoundary getStart() {
        return start;
    }

    public TimeBoundary getStop() {
        return stop;
    }

    public Optional<EvaluationResult> getFixedResult() {
        return Optional.ofNullable(fixedResult);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduleSpec)) return false;
        ScheduleSpec that = (ScheduleSpec) o;
        return days.equals(that.days) && start.equals(that.start) && stop.equals(that.stop)
                && fixedResult == that.fixedResult;
    }

    @Override
    public int hashCode() {
        return Objects.hash(days, start, stop, fixedResult);
    }

    @Override
    public String toString() {
        return days + ":" + start + "-" + stop;
    }
}
