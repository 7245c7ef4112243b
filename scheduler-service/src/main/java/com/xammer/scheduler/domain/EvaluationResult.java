package com.xammer.scheduler.domain;

/**
 * Decision for one resource at one point in time.
 */
public enum EvaluationResult {
    START,
    STOP,
    NO_ACTION
}
