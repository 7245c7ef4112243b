package com.xammer.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleSpecDto {
    private String value;
    private String days;
    private List<String> activeDays; // e.g. ["Mon", "Wed", "Fri"]
    private String start;
    private String stop;
    private boolean preset;
}
