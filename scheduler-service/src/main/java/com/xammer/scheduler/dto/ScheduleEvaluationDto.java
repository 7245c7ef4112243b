package com.xammer.scheduler.dto;

import com.xammer.scheduler.domain.EvaluationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleEvaluationDto {
    private String schedule;
    private ZonedDateTime evaluatedAt;
    private EvaluationResult result;
}
