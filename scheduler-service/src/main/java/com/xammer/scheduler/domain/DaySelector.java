package com.xammer.scheduler.domain;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The days of the week a schedule applies to, together with the expression it was
 * written as ({@code Mon-Fri}, {@code Mon,Wed,Fri}, {@code Sat}...).
 */
public final class DaySelector {

    public static final DaySelector EVERY_DAY = new DaySelector("Mon-Sun", EnumSet.allOf(DayOfWeek.class));
    public static final DaySelector WEEKDAYS = new DaySelector("Mon-Fri",
            EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));
    public static final DaySelector WEEKEND = new DaySelector("Sat-Sun",
            EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY));

    private final String expression;
    private final Set<DayOfWeek> days;

    private DaySelector(String expression, Set<DayOfWeek> days) {
        this.expression = expression;
        this.days = Collections.unmodifiableSet(EnumSet.copyOf(days));
    }

    public static DaySelector of(String expression, Set<DayOfWeek> days) {
        Objects.requireNonNull(expression, "expression");
        if (days == null || days.isEmpty()) {
            throw new IllegalArgumentException("Day selector '" + expression + "' selects no days");
        }
        return new DaySelector(expression, days);
    }

    /**
     * Three-letter English name as used in schedule tags, e.g. {@code Mon}.
     */
    public static String shortName(DayOfWeek day) {
        return day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    /**
     * Resolves a case-sensitive three-letter day name ({@code Mon}..{@code Sun}).
     */
    public static Optional<DayOfWeek> dayOf(String name) {
        for (DayOfWeek day : DayOfWeek.values()) {
            if (shortName(day).equals(name)) {
                return Optional.of(day);
            }
        }
        return Optional.empty();
    }

    public boolean includes(DayOfWeek day) {
        return days.contains(day);
    }

    public String getExpression() {
        return expression;
    }

    public Set<DayOfWeek> getDays() {
        return days;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DaySelector)) return false;
        DaySelector that = (DaySelector) o;
        return expression.equals(that.expression) && days.equals(that.days);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, days);
    }

    @Override
    public String toString() {
        return expression;
    }
}
