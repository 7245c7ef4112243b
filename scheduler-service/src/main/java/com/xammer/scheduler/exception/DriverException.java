package com.xammer.scheduler.exception;

/**
 * A describe, start or stop call against the cloud provider failed.
 */
public class DriverException extends RuntimeException {

    private final String resourceId;

    public DriverException(String resourceId, String message, Throwable cause) {
        super(message, cause);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
