package com.xammer.scheduler.service.aws;

import com.xammer.scheduler.domain.ResourceState;
import com.xammer.scheduler.exception.DriverException;

/**
 * Start/stop/describe operations for a single cloud resource.
 * Implementations wrap provider failures in {@link DriverException}.
 */
public interface ResourceDriver {

    ResourceState describe();

    void start();

    void stop();
}
