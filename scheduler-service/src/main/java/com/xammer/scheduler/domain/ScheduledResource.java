package com.xammer.scheduler.domain;

import com.xammer.scheduler.service.aws.ResourceDriver;
import com.xammer.scheduler.service.aws.TagSource;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A resource picked up by discovery, with what the scheduler needs to evaluate and act on it.
 */
@Getter
@AllArgsConstructor
@ToString(of = {"resourceId", "type"})
public class ScheduledResource {
    private final String resourceId;
    private final ResourceType type;
    private final TagSource tagSource;
    private final ResourceDriver driver;
}
