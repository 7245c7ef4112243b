package com.xammer.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SchedulePresetDto {
    private String name;
    private String days;
    private String start;
    private String stop;
    private String description;
}
