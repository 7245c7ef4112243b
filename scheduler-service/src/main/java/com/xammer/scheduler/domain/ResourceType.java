package com.xammer.scheduler.domain;

public enum ResourceType {
    EC2_INSTANCE("EC2 instance"),
    RDS_INSTANCE("RDS instance");

    private final String label;

    ResourceType(String label) {
        this.label = label;
    }

    /**
     * Human readable name used in action and error messages, e.g. "EC2 instance".
     */
    public String getLabel() {
        return label;
    }
}
