package com.xammer.scheduler.domain;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Start or stop boundary of a schedule: either a concrete time of day or one of the
 * sentinels {@code always}, {@code never} and {@code manual}.
 */
public final class TimeBoundary {

    public enum Kind {
        TIME,
        ALWAYS,
        NEVER,
        MANUAL
    }

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    public static final TimeBoundary ALWAYS = new TimeBoundary(Kind.ALWAYS, null);
    public static final TimeBoundary NEVER = new TimeBoundary(Kind.NEVER, null);
    public static final TimeBoundary MANUAL = new TimeBoundary(Kind.MANUAL, null);

    private final Kind kind;
    private final LocalTime time;

    private TimeBoundary(Kind kind, LocalTime time) {
        this.kind = kind;
        this.time = time;
    }

    public static TimeBoundary at(LocalTime time) {
        return new TimeBoundary(Kind.TIME, Objects.requireNonNull(time, "time"));
    }

    public static TimeBoundary at(int hour, int minute) {
        return at(LocalTime.of(hour, minute));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTime() {
        return kind == Kind.TIME;
    }

    /**
     * @throws IllegalStateException when this boundary is a sentinel
     */
    public LocalTime getTime() {
        if (time == null) {
            throw new IllegalStateException("Boundary '" + this + "' has no time of day");
        }
        return time;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeBoundary)) return false;
        TimeBoundary that = (TimeBoundary) o;
        return kind == that.kind && Objects.equals(time, that.time);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, time);
    }

    @Override
    public String toString() {
        return kind == Kind.TIME ? time.format(HH_MM) : kind.name().toLowerCase();
    }
}
