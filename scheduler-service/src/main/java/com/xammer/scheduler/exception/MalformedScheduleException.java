package com.xammer.scheduler.exception;

/**
 * A schedule value matched neither a preset nor the {@code <days>:<HH:MM>-<HH:MM>} format.
 */
public class MalformedScheduleException extends RuntimeException {

    private final String scheduleValue;

    public MalformedScheduleException(String scheduleValue, String reason) {
        super("Malformed schedule '" + scheduleValue + "': " + reason);
        this.scheduleValue = scheduleValue;
    }

    public String getScheduleValue() {
        return scheduleValue;
    }
}
