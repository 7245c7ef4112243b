package com.xammer.scheduler.domain;

/**
 * Observed state of a cloud resource, as reported by its driver.
 */
public enum ResourceState {
    RUNNING,
    STOPPED,
    TRANSITIONING,
    UNKNOWN
}
