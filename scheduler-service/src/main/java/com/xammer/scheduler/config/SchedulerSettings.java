package com.xammer.scheduler.config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.ZoneId;
import java.util.Optional;

/**
 * Runtime settings for a scheduler pass, resolved once from application properties.
 */
@Getter
@AllArgsConstructor
@ToString
public class SchedulerSettings {
    private final String scheduleTagKey;
    private final String protectionTagKey;
    private final String protectionTagValue;
    private final boolean dryRun;
    private final ZoneId timeZone;
    private final String snsTopicArn;

    public Optional<String> getSnsTopicArn() {
        return snsTopicArn == null || snsTopicArn.isBlank() ? Optional.empty() : Optional.of(snsTopicArn);
    }
}
