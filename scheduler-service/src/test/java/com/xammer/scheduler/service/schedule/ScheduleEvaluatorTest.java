package com.xammer.scheduler.service.schedule;

import com.xammer.scheduler.domain.DaySelector;
import com.xammer.scheduler.domain.EvaluationResult;
import com.xammer.scheduler.domain.ScheduleSpec;
import com.xammer.scheduler.domain.TimeBoundary;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleEvaluatorTest {

    // 2024-01-01 is a Monday
    private static final ZonedDateTime MONDAY_10_00 = at(1, 10, 0);
    private static final ZonedDateTime MONDAY_18_00 = at(1, 18, 0);
    private static final ZonedDateTime MONDAY_23_00 = at(1, 23, 0);
    private static final ZonedDateTime SATURDAY_10_00 = at(6, 10, 0);

    private final ScheduleEvaluator evaluator = evaluator(EvaluationPolicy.LEGACY);

    private static ZonedDateTime at(int dayOfMonth, int hour, int minute) {
        return ZonedDateTime.of(2024, 1, dayOfMonth, hour, minute, 0, 0, ZoneOffset.UTC);
    }

    private static ScheduleEvaluator evaluator(EvaluationPolicy policy) {
        return new ScheduleEvaluator(new ScheduleRegistry(), new CustomScheduleParser(), policy);
    }

    @Test
    void startsInsideWindow() {
        assertThat(evaluator.evaluate("Mon-Fri:09:00-17:00", MONDAY_10_00)).isEqualTo(EvaluationResult.START);
    }

    @Test
    void stopsAfterWindow() {
        assertThat(evaluator.evaluate("Mon-Fri:09:00-17:00", MONDAY_18_00)).isEqualTo(EvaluationResult.STOP);
    }

    @Test
    void dayOutsideRangeForcesStop() {
        assertThat(evaluator.evaluate("Mon-Fri:09:00-17:00", SATURDAY_10_00)).isEqualTo(EvaluationResult.STOP);
    }

    @Test
    void windowBoundsAreInclusive() {
        assertThat(evaluator.evaluate("Mon-Fri:09:00-17:00", at(1, 9, 0))).isEqualTo(EvaluationResult.START);
        assertThat(evaluator.evaluate("Mon-Fri:09:00-17:00", at(1, 17, 0))).isEqualTo(EvaluationResult.START);
        assertThat(evaluator.evaluate("Mon-Fri:09:00-17:00", at(1, 8, 59))).isEqualTo(EvaluationResult.STOP);
    }

    @Test
    void secondsPastTheStopMinuteAreOutside() {
        ZonedDateTime justAfter = MONDAY_10_00.withHour(17).withSecond(30);

        assertThat(evaluator.evaluate("Mon-Fri:09:00-17:00", justAfter)).isEqualTo(EvaluationResult.STOP);
    }

    @Test
    void presetsIgnoreTheClock() {
        for (ZonedDateTime now : new ZonedDateTime[]{MONDAY_10_00, MONDAY_23_00, SATURDAY_10_00}) {
            assertThat(evaluator.evaluate("24x7", now)).isEqualTo(EvaluationResult.START);
            assertThat(evaluator.evaluate("never", now)).isEqualTo(EvaluationResult.STOP);
            assertThat(evaluator.evaluate("demo-only", now)).isEqualTo(EvaluationResult.NO_ACTION);
        }
    }

    @Test
    void businessHoursPreset() {
        assertThat(evaluator.evaluate("business-hours", at(1, 8, 0))).isEqualTo(EvaluationResult.START);
        assertThat(evaluator.evaluate("business-hours", at(1, 7, 59))).isEqualTo(EvaluationResult.STOP);
        assertThat(evaluator.evaluate("business-hours", SATURDAY_10_00)).isEqualTo(EvaluationResult.STOP);
    }

    @Test
    void unresolvableScheduleIsNoAction() {
        assertThat(evaluator.evaluate("Mon-Fri:9-17", MONDAY_10_00)).isEqualTo(EvaluationResult.NO_ACTION);
        assertThat(evaluator.evaluate("office", MONDAY_10_00)).isEqualTo(EvaluationResult.NO_ACTION);
    }

    @Test
    void dayListAndSingleDay() {
        assertThat(evaluator.evaluate("Mon,Wed,Fri:09:00-17:00", MONDAY_10_00)).isEqualTo(EvaluationResult.START);
        assertThat(evaluator.evaluate("Tue,Thu:09:00-17:00", MONDAY_10_00)).isEqualTo(EvaluationResult.STOP);
        assertThat(evaluator.evaluate("Sat:09:00-17:00", SATURDAY_10_00)).isEqualTo(EvaluationResult.START);
        assertThat(evaluator.evaluate("Sat-Sun:09:00-17:00", SATURDAY_10_00)).isEqualTo(EvaluationResult.START);
    }

    @Test
    void sentinelStartBoundaries() {
        ScheduleSpec always = ScheduleSpec.of(DaySelector.WEEKDAYS, TimeBoundary.ALWAYS, TimeBoundary.NEVER);
        ScheduleSpec manual = ScheduleSpec.of(DaySelector.WEEKDAYS, TimeBoundary.MANUAL, TimeBoundary.MANUAL);
        ScheduleSpec never = ScheduleSpec.of(DaySelector.WEEKDAYS, TimeBoundary.NEVER, TimeBoundary.ALWAYS);

        assertThat(evaluator.evaluate(always, MONDAY_23_00)).isEqualTo(EvaluationResult.START);
        assertThat(evaluator.evaluate(manual, MONDAY_23_00)).isEqualTo(EvaluationResult.START);
        assertThat(evaluator.evaluate(never, MONDAY_10_00)).isEqualTo(EvaluationResult.STOP);
        assertThat(evaluator.evaluate(always, SATURDAY_10_00)).isEqualTo(EvaluationResult.STOP);
    }

    @Test
    void startTimeWithoutStopTimeIsNoAction() {
        ScheduleSpec spec = ScheduleSpec.of(DaySelector.EVERY_DAY, TimeBoundary.at(9, 0), TimeBoundary.NEVER);

        assertThat(evaluator.evaluate(spec, MONDAY_10_00)).isEqualTo(EvaluationResult.NO_ACTION);
    }

    @Test
    void overnightWindowNeverMatchesUnderLegacyPolicy() {
        assertThat(evaluator.evaluate("Mon-Sun:22:00-06:00", MONDAY_23_00)).isEqualTo(EvaluationResult.STOP);
        assertThat(evaluator.evaluate("Mon-Sun:22:00-06:00", at(2, 3, 0))).isEqualTo(EvaluationResult.STOP);
    }

    @Test
    void overnightWindowWrapsWhenEnabled() {
        ScheduleEvaluator wrapping = evaluator(new EvaluationPolicy(EvaluationResult.STOP, true));

        assertThat(wrapping.evaluate("Mon-Sun:22:00-06:00", MONDAY_23_00)).isEqualTo(EvaluationResult.START);
        assertThat(wrapping.evaluate("Mon-Sun:22:00-06:00", at(2, 3, 0))).isEqualTo(EvaluationResult.START);
        assertThat(wrapping.evaluate("Mon-Sun:22:00-06:00", MONDAY_10_00)).isEqualTo(EvaluationResult.STOP);
        assertThat(wrapping.evaluate("Mon-Fri:09:00-17:00", MONDAY_10_00)).isEqualTo(EvaluationResult.START);
    }

    @Test
    void outsideDaysResultIsConfigurable() {
        ScheduleEvaluator lenient = evaluator(new EvaluationPolicy(EvaluationResult.NO_ACTION, false));

        assertThat(lenient.evaluate("Mon-Fri:09:00-17:00", SATURDAY_10_00)).isEqualTo(EvaluationResult.NO_ACTION);
        assertThat(lenient.evaluate("Mon-Fri:09:00-17:00", MONDAY_18_00)).isEqualTo(EvaluationResult.STOP);
    }

    @Test
    void usesTheWeekdayOfTheSuppliedZone() {
        // Monday 23:00 UTC is already Tuesday in Tokyo
        ZonedDateTime tokyo = MONDAY_23_00.withZoneSameInstant(ZoneId.of("Asia/Tokyo"));

        assertThat(evaluator.evaluate("Tue:08:00-09:00", tokyo)).isEqualTo(EvaluationResult.START);
    }
}
