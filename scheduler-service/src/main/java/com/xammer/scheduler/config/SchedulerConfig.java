package com.xammer.scheduler.config;

import com.xammer.scheduler.domain.EvaluationResult;
import com.xammer.scheduler.service.schedule.EvaluationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Configuration
public class SchedulerConfig {

    private static final Logger logger = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public SchedulerSettings schedulerSettings(
            @Value("${scheduler.tag-key:AutoSchedule}") String scheduleTagKey,
            @Value("${scheduler.protection.tag-key:DoNotShutdown}") String protectionTagKey,
            @Value("${scheduler.protection.tag-value:true}") String protectionTagValue,
            @Value("${scheduler.dry-run:false}") boolean dryRun,
            @Value("${scheduler.time-zone:UTC}") String timeZone,
            @Value("${scheduler.sns.topic-arn:}") String snsTopicArn) {
        SchedulerSettings settings = new SchedulerSettings(scheduleTagKey, protectionTagKey, protectionTagValue,
                dryRun, resolveZone(timeZone), snsTopicArn);
        logger.info("Resource scheduler settings: {}", settings);
        return settings;
    }

    @Bean
    public EvaluationPolicy evaluationPolicy(
            @Value("${scheduler.evaluation.outside-days-result:STOP}") EvaluationResult outsideDaysResult,
            @Value("${scheduler.evaluation.wrap-overnight:false}") boolean wrapOvernight) {
        return new EvaluationPolicy(outsideDaysResult, wrapOvernight);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static ZoneId resolveZone(String timeZone) {
        try {
            return ZoneId.of(timeZone);
        } catch (DateTimeException e) {
            logger.warn("Invalid scheduler time zone '{}', using UTC", timeZone);
            return ZoneOffset.UTC;
        }
    }
}
