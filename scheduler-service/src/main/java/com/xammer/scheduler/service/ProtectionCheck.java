package com.xammer.scheduler.service;

import com.xammer.scheduler.config.SchedulerSettings;
import com.xammer.scheduler.domain.ResourceTags;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * A resource is protected from automatic stops when its protection tag (by default
 * {@code DoNotShutdown}) is set to the protection value, ignoring case. Starts are never
 * suppressed.
 */
@Component
public class ProtectionCheck {

    private final String tagKey;
    private final String tagValue;

    @Autowired
    public ProtectionCheck(SchedulerSettings settings) {
        this(settings.getProtectionTagKey(), settings.getProtectionTagValue());
    }

    public ProtectionCheck(String tagKey, String tagValue) {
        this.tagKey = tagKey;
        this.tagValue = tagValue;
    }

    public boolean isProtected(ResourceTags tags) {
        return tags.lookup(tagKey)
                .map(value -> value.equalsIgnoreCase(tagValue))
                .orElse(false);
    }
}
