package com.xammer.scheduler.service;

import com.xammer.scheduler.config.SchedulerSettings;
import com.xammer.scheduler.domain.ResourceType;
import com.xammer.scheduler.dto.ResourceErrorDto;
import com.xammer.scheduler.dto.ResourceTypeSummary;
import com.xammer.scheduler.dto.SchedulerRunSummary;
import com.xammer.scheduler.service.schedule.SchedulePreset;
import com.xammer.scheduler.service.schedule.ScheduleRegistry;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

@Service
public class SchedulerReportFormatter {

    private static final DateTimeFormatter SUBJECT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneOffset.UTC);

    private final ScheduleRegistry registry;
    private final SchedulerSettings settings;

    public SchedulerReportFormatter(ScheduleRegistry registry, SchedulerSettings settings) {
        this.registry = registry;
        this.settings = settings;
    }

    public String buildSubject(SchedulerRunSummary summary) {
        return "AWS Resource Scheduler Report - " + SUBJECT_TIME.format(summary.getTimestamp());
    }

    /**
     * Builds the plain-text report body: counters per resource type, actions, errors and a
     * reminder of the available schedules and tags.
     */
    public String buildReport(SchedulerRunSummary summary) {
        StringBuilder sb = new StringBuilder();
        String mode = summary.isDryRun() ? "DRY RUN" : "EXECUTION";

        sb.append(String.format("AWS Resource Scheduler Report (%s)%n", mode));
        sb.append("=====================================\n\n");
        sb.append(String.format("Execution Time: %s%n", summary.getTimestamp()));
        sb.append(String.format("Status: %s%n%n", summary.getStatus()));

        sb.append("SUMMARY:\n");
        for (ResourceType type : ResourceType.values()) {
            ResourceTypeSummary counts = summary.getByType().getOrDefault(type, new ResourceTypeSummary());
            String label = capitalize(type.getLabel()) + "s";
            sb.append(String.format("- %s Processed: %d%n", label, counts.getProcessed()));
            sb.append(String.format("- %s Started: %d%n", label, counts.getStarted()));
            sb.append(String.format("- %s Stopped: %d%n", label, counts.getStopped()));
        }

        sb.append("\nACTIONS TAKEN:\n");
        if (summary.getActionsTaken().isEmpty()) {
            sb.append("- none\n");
        }
        for (String action : summary.getActionsTaken()) {
            sb.append("- ").append(action).append('\n');
        }

        if (!summary.getProtectedResources().isEmpty()) {
            sb.append(String.format("%nPROTECTED (%d):%n", summary.getProtectedResources().size()));
            for (String resource : summary.getProtectedResources()) {
                sb.append("- ").append(resource).append('\n');
            }
        }

        if (!summary.getErrors().isEmpty()) {
            sb.append(String.format("%nERRORS (%d):%n", summary.getErrors().size()));
            for (ResourceErrorDto error : summary.getErrors()) {
                sb.append("- ").append(error.getMessage()).append('\n');
            }
        }

        sb.append("\nSCHEDULE TYPES:\n");
        for (SchedulePreset preset : registry.getPresets()) {
            sb.append(String.format("- %s: %s%n", preset.getName(), preset.getDescription()));
        }
        sb.append("- custom: Format like \"Mon-Fri:09:00-17:00\"\n");

        sb.append("\nTAGGING:\n");
        sb.append(String.format("Tag resources with \"%s=<schedule>\" to enable scheduling.%n",
                settings.getScheduleTagKey()));
        sb.append(String.format("Add \"%s=%s\" to protect critical resources.%n",
                settings.getProtectionTagKey(), settings.getProtectionTagValue()));

        return sb.toString();
    }

    private static String capitalize(String label) {
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
