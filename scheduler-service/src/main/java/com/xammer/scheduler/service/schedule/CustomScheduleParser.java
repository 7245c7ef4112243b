package com.xammer.scheduler.service.schedule;

import com.xammer.scheduler.domain.DaySelector;
import com.xammer.scheduler.domain.ScheduleSpec;
import com.xammer.scheduler.domain.TimeBoundary;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses custom schedules of the form {@code <days>:<HH:MM>-<HH:MM>}, e.g.
 * {@code Mon-Fri:09:00-17:00} or {@code Mon,Wed,Fri:07:30-19:00}.
 * <p>
 * The day segment ends at the first colon, and start and stop are separated by the last
 * dash of the remainder, so dashes inside the day segment are never mistaken for the time
 * separator.
 */
@Component
public class CustomScheduleParser {

    private static final Pattern HH_MM = Pattern.compile("([01]\\d|2[0-3]):([0-5]\\d)");

    public ScheduleParseResult parse(String value) {
        if (value == null || value.isEmpty()) {
            return ScheduleParseResult.failure(value, "schedule is empty");
        }

        int colon = value.indexOf(':');
        if (colon < 0) {
            return ScheduleParseResult.failure(value, "expected <days>:<HH:MM>-<HH:MM>");
        }

        String daysPart = value.substring(0, colon);
        String timePart = value.substring(colon + 1);
        if (daysPart.isEmpty()) {
            return ScheduleParseResult.failure(value, "day segment is empty");
        }

        Optional<DaySelector> days = parseDays(daysPart);
        if (days.isEmpty()) {
            return ScheduleParseResult.failure(value, "unsupported day expression '" + daysPart + "'");
        }

        int dash = timePart.lastIndexOf('-');
        if (dash < 0) {
            return ScheduleParseResult.failure(value, "time range must be <HH:MM>-<HH:MM>");
        }

        String startToken = timePart.substring(0, dash);
        String stopToken = timePart.substring(dash + 1);
        Optional<LocalTime> start = parseTime(startToken);
        if (start.isEmpty()) {
            return ScheduleParseResult.failure(value, "invalid start time '" + startToken + "'");
        }
        Optional<LocalTime> stop = parseTime(stopToken);
        if (stop.isEmpty()) {
            return ScheduleParseResult.failure(value, "invalid stop time '" + stopToken + "'");
        }

        return ScheduleParseResult.success(value,
                ScheduleSpec.of(days.get(), TimeBoundary.at(start.get()), TimeBoundary.at(stop.get())));
    }

    Optional<DaySelector> parseDays(String expression) {
        if (DaySelector.EVERY_DAY.getExpression().equals(expression)) {
            return Optional.of(DaySelector.EVERY_DAY);
        }
        if (DaySelector.WEEKDAYS.getExpression().equals(expression)) {
            return Optional.of(DaySelector.WEEKDAYS);
        }
        if (DaySelector.WEEKEND.getExpression().equals(expression)) {
            return Optional.of(DaySelector.WEEKEND);
        }

        Set<DayOfWeek> selected = EnumSet.noneOf(DayOfWeek.class);
        for (String name : expression.split(",", -1)) {
            Optional<DayOfWeek> day = DaySelector.dayOf(name.trim());
            if (day.isEmpty()) {
                return Optional.empty();
            }
            selected.add(day.get());
        }
        return Optional.of(DaySelector.of(expression, selected));
    }

    Optional<LocalTime> parseTime(String token) {
        Matcher m = HH_MM.matcher(token);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(LocalTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
    }
}
