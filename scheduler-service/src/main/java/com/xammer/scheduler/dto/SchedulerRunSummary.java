package com.xammer.scheduler.dto;

import com.xammer.scheduler.domain.ResourceType;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one scheduler pass. Always carries both the actions taken and the errors,
 * so a partial success can be told apart from a clean run.
 */
@Data
@NoArgsConstructor
public class SchedulerRunSummary {

    public enum Status {
        SUCCESS,
        COMPLETED_WITH_ERRORS
    }

    private Instant timestamp;
    private boolean dryRun;
    private Status status = Status.SUCCESS;
    private int processed;
    private int started;
    private int stopped;
    private Map<ResourceType, ResourceTypeSummary> byType = new EnumMap<>(ResourceType.class);
    private List<String> actionsTaken = new ArrayList<>();
    private List<String> protectedResources = new ArrayList<>();
    private List<ResourceErrorDto> errors = new ArrayList<>();

    public ResourceTypeSummary forType(ResourceType type) {
        return byType.computeIfAbsent(type, t -> new ResourceTypeSummary());
    }

    public boolean hasActionsOrErrors() {
        return !actionsTaken.isEmpty() || !errors.isEmpty();
    }
}
