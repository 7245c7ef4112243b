package com.xammer.scheduler.service;

import com.xammer.scheduler.config.SchedulerSettings;
import com.xammer.scheduler.dto.SchedulerRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.PublishRequest;

import java.util.Optional;

/**
 * Publishes run reports to the configured SNS topic. Publishing is skipped when no topic is
 * configured, and failures are logged without affecting the run.
 */
@Service
public class SnsSchedulerNotifier implements SchedulerNotifier {

    private static final Logger logger = LoggerFactory.getLogger(SnsSchedulerNotifier.class);

    private final SnsClient snsClient;
    private final SchedulerReportFormatter formatter;
    private final SchedulerSettings settings;

    public SnsSchedulerNotifier(SnsClient snsClient, SchedulerReportFormatter formatter, SchedulerSettings settings) {
        this.snsClient = snsClient;
        this.formatter = formatter;
        this.settings = settings;
    }

    @Override
    public void publish(SchedulerRunSummary summary) {
        Optional<String> topicArn = settings.getSnsTopicArn();
        if (topicArn.isEmpty()) {
            logger.debug("No SNS topic configured, skipping scheduler report");
            return;
        }

        try {
            snsClient.publish(PublishRequest.builder()
                    .topicArn(topicArn.get())
                    .subject(formatter.buildSubject(summary))
                    .message(formatter.buildReport(summary))
                    .build());
            logger.info("Scheduler report published to {}", topicArn.get());
        } catch (SdkException e) {
            logger.error("Failed to publish scheduler report to {}: {}", topicArn.get(), e.getMessage(), e);
        }
    }
}
