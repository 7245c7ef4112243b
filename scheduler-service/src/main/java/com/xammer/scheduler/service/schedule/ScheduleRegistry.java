package com.xammer.scheduler.service.schedule;

import com.xammer.scheduler.domain.DaySelector;
import com.xammer.scheduler.domain.EvaluationResult;
import com.xammer.scheduler.domain.ScheduleSpec;
import com.xammer.scheduler.domain.TimeBoundary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named schedules that can be used as a tag value instead of a custom expression.
 */
@Component
public class ScheduleRegistry {

    public static final String BUSINESS_HOURS = "business-hours";
    public static final String DEV_HOURS = "dev-hours";
    public static final String DEMO_ONLY = "demo-only";
    public static final String ALWAYS_ON = "24x7";
    public static final String ALWAYS_OFF = "never";

    private final Map<String, SchedulePreset> presets = new LinkedHashMap<>();

    public ScheduleRegistry() {
        register(BUSINESS_HOURS,
                ScheduleSpec.of(DaySelector.WEEKDAYS, TimeBoundary.at(8, 0), TimeBoundary.at(18, 0)),
                "Mon-Fri 08:00-18:00");
        register(DEV_HOURS,
                ScheduleSpec.of(DaySelector.WEEKDAYS, TimeBoundary.at(9, 0), TimeBoundary.at(17, 0)),
                "Mon-Fri 09:00-17:00");
        register(DEMO_ONLY,
                ScheduleSpec.fixed(DaySelector.EVERY_DAY, TimeBoundary.MANUAL, TimeBoundary.MANUAL,
                        EvaluationResult.NO_ACTION),
                "Manual control only");
        register(ALWAYS_ON,
                ScheduleSpec.fixed(DaySelector.EVERY_DAY, TimeBoundary.ALWAYS, TimeBoundary.NEVER,
                        EvaluationResult.START),
                "Always running");
        register(ALWAYS_OFF,
                ScheduleSpec.fixed(DaySelector.EVERY_DAY, TimeBoundary.NEVER, TimeBoundary.ALWAYS,
                        EvaluationResult.STOP),
                "Always stopped");
    }

    private void register(String name, ScheduleSpec spec, String description) {
        presets.put(name, new SchedulePreset(name, spec, description));
    }

    /**
     * @return the preset's spec, or empty when {@code name} is not a preset and should be
     *         parsed as a custom schedule
     */
    public Optional<ScheduleSpec> lookup(String name) {
        SchedulePreset preset = presets.get(name);
        return preset == null ? Optional.empty() : Optional.of(preset.getSpec());
    }

    public List<SchedulePreset> getPresets() {
        return Collections.unmodifiableList(new ArrayList<>(presets.values()));
    }
}
