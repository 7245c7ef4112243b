package com.xammer.scheduler.service.schedule;

import com.xammer.scheduler.domain.ScheduleSpec;
import com.xammer.scheduler.exception.MalformedScheduleException;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing a custom schedule: either a spec or the reason it was rejected.
 */
public final class ScheduleParseResult {

    private final String input;
    private final ScheduleSpec spec;
    private final String error;

    private ScheduleParseResult(String input, ScheduleSpec spec, String error) {
        this.input = input;
        this.spec = spec;
        this.error = error;
    }

    static ScheduleParseResult success(String input, ScheduleSpec spec) {
        return new ScheduleParseResult(input, Objects.requireNonNull(spec, "spec"), null);
    }

    static ScheduleParseResult failure(String input, String error) {
        return new ScheduleParseResult(input, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return spec != null;
    }

    public String getInput() {
        return input;
    }

    public Optional<ScheduleSpec> getSpec() {
        return Optional.ofNullable(spec);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public ScheduleSpec getSpecOrThrow() {
        if (spec == null) {
            throw new MalformedScheduleException(input, error);
        }
        return spec;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Parsed(" + spec + ")" : "Rejected(" + input + ": " + error + ")";
    }
}
