package com.xammer.scheduler.service.schedule;

import com.xammer.scheduler.domain.ScheduleSpec;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SchedulePreset {
    private final String name;
    private final ScheduleSpec spec;
    private final String description;
}
