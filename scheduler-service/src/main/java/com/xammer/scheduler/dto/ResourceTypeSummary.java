package com.xammer.scheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResourceTypeSummary {
    private int processed;
    private int started;
    private int stopped;
}
