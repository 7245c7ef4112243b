package com.xammer.scheduler.service.schedule;

import com.xammer.scheduler.domain.ScheduleSpec;
import com.xammer.scheduler.domain.TimeBoundary;
import com.xammer.scheduler.exception.MalformedScheduleException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DayOfWeek;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CustomScheduleParserTest {

    private final CustomScheduleParser parser = new CustomScheduleParser();

    @Test
    void parsesWeekdayRange() {
        ScheduleSpec spec = parser.parse("Mon-Fri:09:00-17:00").getSpecOrThrow();

        assertThat(spec.getDays().getExpression()).isEqualTo("Mon-Fri");
        assertThat(spec.getDays().getDays()).containsExactly(DayOfWeek.MONDAY, DayOfWeek.TUESDAY,
                DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY);
        assertThat(spec.getStart()).isEqualTo(TimeBoundary.at(9, 0));
        assertThat(spec.getStop()).isEqualTo(TimeBoundary.at(17, 0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Mon-Sun:00:00-23:59", "Sat-Sun:10:15-14:45", "Mon,Wed,Fri:07:30-19:00", "Tue:08:00-12:00"})
    void validSchedulesPrintBackToTheirInput(String value) {
        ScheduleParseResult result = parser.parse(value);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSpecOrThrow().toString()).isEqualTo(value);
    }

    @Test
    void commaListItemsAreTrimmed() {
        ScheduleSpec spec = parser.parse("Mon, Wed:09:00-10:00").getSpecOrThrow();

        assertThat(spec.getDays().getDays()).containsExactly(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Mon-Fri:9-17",
            "Mon-Fri:9:00-17:00",
            "Mon-Fri:09:00",
            "Mon-Fri:24:00-17:00",
            "Mon-Fri:09:60-17:00",
            "Mon-Fri:09:00-17:00-18:00",
            ":09:00-17:00",
            "Mon-Fri",
            "Funday:09:00-17:00",
            "mon:09:00-17:00",
            "Tue-Thu:09:00-17:00",
            "Mon,,Fri:09:00-17:00",
            "always-on"
    })
    void rejectsMalformedSchedules(String value) {
        ScheduleParseResult result = parser.parse(value);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getSpec()).isEmpty();
        assertThat(result.getError()).isPresent();
        assertThatThrownBy(result::getSpecOrThrow)
                .isInstanceOf(MalformedScheduleException.class)
                .hasMessageContaining(value);
    }

    @Test
    void reportsWhichPartIsWrong() {
        assertThat(parser.parse(":09:00-17:00").getError()).contains("day segment is empty");
        assertThat(parser.parse("Mon-Fri:9-17").getError()).contains("invalid start time '9'");
        assertThat(parser.parse("Mon-Fri:09:00-5pm").getError()).contains("invalid stop time '5pm'");
    }

    @Test
    void emptyAndNullAreRejected() {
        assertThat(parser.parse("").isSuccess()).isFalse();
        assertThat(parser.parse(null).isSuccess()).isFalse();
    }
}
