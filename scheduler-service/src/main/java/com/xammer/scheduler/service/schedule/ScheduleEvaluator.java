package com.xammer.scheduler.service.schedule;

import com.xammer.scheduler.domain.EvaluationResult;
import com.xammer.scheduler.domain.ScheduleSpec;
import com.xammer.scheduler.domain.TimeBoundary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Decides whether a resource should be running at a given moment.
 */
@Service
public class ScheduleEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleEvaluator.class);

    private final ScheduleRegistry registry;
    private final CustomScheduleParser parser;
    private final EvaluationPolicy policy;

    public ScheduleEvaluator(ScheduleRegistry registry, CustomScheduleParser parser, EvaluationPolicy policy) {
        this.registry = registry;
        this.parser = parser;
        this.policy = policy;
    }

    /**
     * Resolves a schedule tag value (preset name first, then custom format) and evaluates it.
     * Values that cannot be resolved yield {@link EvaluationResult#NO_ACTION}.
     */
    public EvaluationResult evaluate(String scheduleValue, ZonedDateTime now) {
        Optional<ScheduleSpec> spec = resolve(scheduleValue);
        if (spec.isEmpty()) {
            return EvaluationResult.NO_ACTION;
        }
        return evaluate(spec.get(), now);
    }

    public Optional<ScheduleSpec> resolve(String scheduleValue) {
        Optional<ScheduleSpec> preset = registry.lookup(scheduleValue);
        if (preset.isPresent()) {
            return preset;
        }
        ScheduleParseResult parsed = parser.parse(scheduleValue);
        if (!parsed.isSuccess()) {
            logger.warn("Unknown schedule format '{}': {}", scheduleValue, parsed.getError().orElse("rejected"));
        }
        return parsed.getSpec();
    }

    public EvaluationResult evaluate(ScheduleSpec spec, ZonedDateTime now) {
        Optional<EvaluationResult> fixed = spec.getFixedResult();
        if (fixed.isPresent()) {
            return fixed.get();
        }

        if (!spec.getDays().includes(now.getDayOfWeek())) {
            logger.debug("{} is outside days '{}'", now.getDayOfWeek(), spec.getDays());
            return policy.getOutsideDaysResult();
        }

        TimeBoundary start = spec.getStart();
        switch (start.getKind()) {
            case ALWAYS:
            case MANUAL:
                return EvaluationResult.START;
            case NEVER:
                return EvaluationResult.STOP;
            default:
                break;
        }

        TimeBoundary stop = spec.getStop();
        if (!stop.isTime()) {
            logger.warn("Schedule {} has a start time but no stop time", spec);
            return EvaluationResult.NO_ACTION;
        }

        return withinWindow(now.toLocalTime(), start.getTime(), stop.getTime())
                ? EvaluationResult.START
                : EvaluationResult.STOP;
    }

    private boolean withinWindow(LocalTime t, LocalTime start, LocalTime stop) {
        if (policy.isWrapOvernightWindows() && stop.isBefore(start)) {
            return !t.isBefore(start) || !t.isAfter(stop);
        }
        return !t.isBefore(start) && !t.isAfter(stop);
    }

    public EvaluationPolicy getPolicy() {
        return policy;
    }
}
