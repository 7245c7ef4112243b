package com.xammer.scheduler.service.schedule;

import com.xammer.scheduler.domain.DaySelector;
import com.xammer.scheduler.domain.EvaluationResult;
import com.xammer.scheduler.domain.ScheduleSpec;
import com.xammer.scheduler.domain.TimeBoundary;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleRegistryTest {

    private final ScheduleRegistry registry = new ScheduleRegistry();

    @Test
    void businessHoursIsWeekdaysEightToSix() {
        ScheduleSpec spec = registry.lookup("business-hours").orElseThrow();

        assertThat(spec.getDays()).isEqualTo(DaySelector.WEEKDAYS);
        assertThat(spec.getStart()).isEqualTo(TimeBoundary.at(8, 0));
        assertThat(spec.getStop()).isEqualTo(TimeBoundary.at(18, 0));
        assertThat(spec.getFixedResult()).isEmpty();
    }

    @Test
    void devHoursIsWeekdaysNineToFive() {
        ScheduleSpec spec = registry.lookup("dev-hours").orElseThrow();

        assertThat(spec.getDays().getExpression()).isEqualTo("Mon-Fri");
        assertThat(spec.getStart().toString()).isEqualTo("09:00");
        assertThat(spec.getStop().toString()).isEqualTo("17:00");
    }

    @Test
    void sentinelPresetsPinTheirDecision() {
        assertThat(registry.lookup("24x7").orElseThrow().getFixedResult()).contains(EvaluationResult.START);
        assertThat(registry.lookup("never").orElseThrow().getFixedResult()).contains(EvaluationResult.STOP);

        ScheduleSpec demo = registry.lookup("demo-only").orElseThrow();
        assertThat(demo.getFixedResult()).contains(EvaluationResult.NO_ACTION);
        assertThat(demo.getStart()).isEqualTo(TimeBoundary.MANUAL);
        assertThat(demo.getDays()).isEqualTo(DaySelector.EVERY_DAY);
    }

    @Test
    void unknownNamesAreNotPresets() {
        assertThat(registry.lookup("Mon-Fri:09:00-17:00")).isEmpty();
        assertThat(registry.lookup("Business-Hours")).isEmpty();
        assertThat(registry.lookup("")).isEmpty();
    }

    @Test
    void listsPresetsInDeclarationOrder() {
        assertThat(registry.getPresets())
                .extracting(SchedulePreset::getName)
                .containsExactly("business-hours", "dev-hours", "demo-only", "24x7", "never");
    }
}
