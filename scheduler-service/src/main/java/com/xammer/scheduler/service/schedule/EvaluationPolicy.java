package com.xammer.scheduler.service.schedule;

import com.xammer.scheduler.domain.EvaluationResult;

import java.util.Objects;

/**
 * Knobs for the two behaviors of the evaluator that differ from what a reader might expect.
 * {@link #LEGACY} keeps the historical behavior: a day outside the schedule forces a stop,
 * and a window whose stop time precedes its start time never matches.
 */
public final class EvaluationPolicy {

    public static final EvaluationPolicy LEGACY = new EvaluationPolicy(EvaluationResult.STOP, false);

    private final EvaluationResult outsideDaysResult;
    private final boolean wrapOvernightWindows;

    public EvaluationPolicy(EvaluationResult outsideDaysResult, boolean wrapOvernightWindows) {
        this.outsideDaysResult = Objects.requireNonNull(outsideDaysResult, "outsideDaysResult");
        this.wrapOvernightWindows = wrapOvernightWindows;
    }

    public EvaluationResult getOutsideDaysResult() {
        return outsideDaysResult;
    }

    /**
     * When set, a window like {@code 22:00-06:00} matches from the start time through
     * midnight until the stop time.
     */
    public boolean isWrapOvernightWindows() {
        return wrapOvernightWindows;
    }

    @Override
    public String toString() {
        return "EvaluationPolicy{outsideDays=" + outsideDaysResult + ", wrapOvernight=" + wrapOvernightWindows + "}";
    }
}
