package com.xammer.scheduler.exception;

public class TagLookupException extends RuntimeException {

    private final String resourceId;

    public TagLookupException(String resourceId, String message, Throwable cause) {
        super(message, cause);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
