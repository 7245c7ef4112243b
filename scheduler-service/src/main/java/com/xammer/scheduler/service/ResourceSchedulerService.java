package com.xammer.scheduler.service;

import com.xammer.scheduler.config.SchedulerSettings;
import com.xammer.scheduler.domain.EvaluationResult;
import com.xammer.scheduler.domain.ResourceState;
import com.xammer.scheduler.domain.ResourceTags;
import com.xammer.scheduler.domain.ResourceType;
import com.xammer.scheduler.domain.ScheduledResource;
import com.xammer.scheduler.dto.ResourceErrorDto;
import com.xammer.scheduler.dto.ResourceTypeSummary;
import com.xammer.scheduler.dto.SchedulerRunSummary;
import com.xammer.scheduler.exception.TagLookupException;
import com.xammer.scheduler.service.aws.ResourceDiscovery;
import com.xammer.scheduler.service.schedule.ScheduleEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Runs one scheduling pass: discovers tagged resources, evaluates their schedules and starts
 * or stops them. A failure on one resource is recorded in the summary and never stops the
 * rest of the batch.
 */
@Service
public class ResourceSchedulerService {

    private static final Logger logger = LoggerFactory.getLogger(ResourceSchedulerService.class);

    private final List<ResourceDiscovery> discoveries;
    private final ScheduleEvaluator evaluator;
    private final ProtectionCheck protectionCheck;
    private final SchedulerNotifier notifier;
    private final SchedulerSettings settings;
    private final Clock clock;

    public ResourceSchedulerService(List<ResourceDiscovery> discoveries,
            ScheduleEvaluator evaluator,
            ProtectionCheck protectionCheck,
            SchedulerNotifier notifier,
            SchedulerSettings settings,
            Clock clock) {
        this.discoveries = discoveries;
        this.evaluator = evaluator;
        this.protectionCheck = protectionCheck;
        this.notifier = notifier;
        this.settings = settings;
        this.clock = clock;
    }

    public SchedulerRunSummary run() {
        return run(settings.isDryRun());
    }

    public SchedulerRunSummary run(boolean dryRun) {
        long startTime = System.currentTimeMillis();
        ZonedDateTime now = now();
        logger.info("Resource scheduler: starting run at {} (dryRun={})", now, dryRun);

        SchedulerRunSummary summary = newSummary(now, dryRun);
        for (ResourceDiscovery discovery : discoveries) {
            ResourceType type = discovery.getResourceType();
            List<ScheduledResource> resources;
            try {
                resources = discovery.discover();
            } catch (RuntimeException e) {
                String message = "Error listing " + type.getLabel() + "s: " + e.getMessage();
                logger.error(message, e);
                summary.getErrors().add(new ResourceErrorDto(null, type, ResourceErrorDto.Kind.DISCOVERY, message));
                continue;
            }
            for (ScheduledResource resource : resources) {
                processResource(resource, now, dryRun, summary);
            }
        }
        finish(summary);

        if (summary.hasActionsOrErrors()) {
            try {
                notifier.publish(summary);
            } catch (RuntimeException e) {
                logger.error("Failed to send scheduler notification: {}", e.getMessage(), e);
            }
        }

        logger.info("Resource scheduler: run complete in {}ms - {} processed, {} started, {} stopped, {} error(s)",
                System.currentTimeMillis() - startTime, summary.getProcessed(), summary.getStarted(),
                summary.getStopped(), summary.getErrors().size());
        return summary;
    }

    /**
     * Evaluates and acts on an explicit list of resources, without discovery or notification.
     */
    public SchedulerRunSummary process(List<ScheduledResource> resources, ZonedDateTime now, boolean dryRun) {
        SchedulerRunSummary summary = newSummary(now, dryRun);
        for (ScheduledResource resource : resources) {
            processResource(resource, now, dryRun, summary);
        }
        finish(summary);
        return summary;
    }

    private void processResource(ScheduledResource resource, ZonedDateTime now, boolean dryRun,
            SchedulerRunSummary summary) {
        String resourceId = resource.getResourceId();
        ResourceType type = resource.getType();
        ResourceTypeSummary counts = summary.forType(type);

        counts.setProcessed(counts.getProcessed() + 1);
        summary.setProcessed(summary.getProcessed() + 1);

        try {
            ResourceTags tags = resource.getTagSource().fetchTags();
            Optional<String> schedule = tags.lookup(settings.getScheduleTagKey())
                    .filter(value -> !value.isEmpty());
            if (schedule.isEmpty()) {
                logger.debug("{} {} has no schedule tag, skipping", type.getLabel(), resourceId);
                return;
            }

            EvaluationResult desired = evaluator.evaluate(schedule.get(), now);
            if (desired == EvaluationResult.NO_ACTION) {
                logger.debug("{} {}: no action for schedule '{}'", type.getLabel(), resourceId, schedule.get());
                return;
            }

            ResourceState state = resource.getDriver().describe();
            logger.debug("{} {}: schedule '{}' wants {}, current state {}",
                    type.getLabel(), resourceId, schedule.get(), desired, state);

            if (desired == EvaluationResult.START && state == ResourceState.STOPPED) {
                if (!dryRun) {
                    resource.getDriver().start();
                }
                summary.getActionsTaken().add("Started " + type.getLabel() + ": " + resourceId);
                counts.setStarted(counts.getStarted() + 1);
                summary.setStarted(summary.getStarted() + 1);
                logger.info("Started {} {}{}", type.getLabel(), resourceId, dryRun ? " (dry run)" : "");

            } else if (desired == EvaluationResult.STOP && state == ResourceState.RUNNING) {
                if (protectionCheck.isProtected(tags)) {
                    logger.info("{} {} is protected from stopping", type.getLabel(), resourceId);
                    summary.getProtectedResources().add(type.getLabel() + ": " + resourceId);
                    return;
                }
                if (!dryRun) {
                    resource.getDriver().stop();
                }
                summary.getActionsTaken().add("Stopped " + type.getLabel() + ": " + resourceId);
                counts.setStopped(counts.getStopped() + 1);
                summary.setStopped(summary.getStopped() + 1);
                logger.info("Stopped {} {}{}", type.getLabel(), resourceId, dryRun ? " (dry run)" : "");
            }
        } catch (TagLookupException e) {
            String message = e.getMessage();
            logger.warn(message);
            summary.getErrors().add(new ResourceErrorDto(resourceId, type, ResourceErrorDto.Kind.TAG_LOOKUP, message));
        } catch (RuntimeException e) {
            String message = "Error processing " + type.getLabel() + " " + resourceId + ": " + e.getMessage();
            logger.error(message, e);
            summary.getErrors().add(new ResourceErrorDto(resourceId, type, ResourceErrorDto.Kind.DRIVER, message));
        }
    }

    private SchedulerRunSummary newSummary(ZonedDateTime now, boolean dryRun) {
        SchedulerRunSummary summary = new SchedulerRunSummary();
        summary.setTimestamp(now.toInstant());
        summary.setDryRun(dryRun);
        return summary;
    }

    private void finish(SchedulerRunSummary summary) {
        summary.setStatus(summary.getErrors().isEmpty()
                ? SchedulerRunSummary.Status.SUCCESS
                : SchedulerRunSummary.Status.COMPLETED_WITH_ERRORS);
    }

    public ZonedDateTime now() {
        return ZonedDateTime.now(clock).withZoneSameInstant(settings.getTimeZone());
    }
}
