package com.xammer.scheduler.service;

import com.xammer.scheduler.dto.SchedulerRunSummary;

/**
 * Delivers the summary of a scheduler pass to operators.
 */
public interface SchedulerNotifier {

    void publish(SchedulerRunSummary summary);
}
