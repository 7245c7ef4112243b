package com.xammer.scheduler.controller;

import com.xammer.scheduler.domain.DaySelector;
import com.xammer.scheduler.domain.ScheduleSpec;
import com.xammer.scheduler.dto.ScheduleEvaluationDto;
import com.xammer.scheduler.dto.SchedulePresetDto;
import com.xammer.scheduler.dto.ScheduleSpecDto;
import com.xammer.scheduler.dto.SchedulerRunSummary;
import com.xammer.scheduler.service.ResourceSchedulerService;
import com.xammer.scheduler.service.schedule.CustomScheduleParser;
import com.xammer.scheduler.service.schedule.ScheduleEvaluator;
import com.xammer.scheduler.service.schedule.ScheduleRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {

    private final ResourceSchedulerService schedulerService;
    private final ScheduleRegistry registry;
    private final CustomScheduleParser parser;
    private final ScheduleEvaluator evaluator;

    public SchedulerController(ResourceSchedulerService schedulerService,
            ScheduleRegistry registry,
            CustomScheduleParser parser,
            ScheduleEvaluator evaluator) {
        this.schedulerService = schedulerService;
        this.registry = registry;
        this.parser = parser;
        this.evaluator = evaluator;
    }

    @GetMapping("/presets")
    public ResponseEntity<List<SchedulePresetDto>> getPresets() {
        List<SchedulePresetDto> presets = registry.getPresets().stream()
                .map(p -> new SchedulePresetDto(p.getName(), p.getSpec().getDays().getExpression(),
                        p.getSpec().getStart().toString(), p.getSpec().getStop().toString(), p.getDescription()))
                .collect(Collectors.toList());
        return ResponseEntity.ok(presets);
    }

    // Rejected values are turned into a 400 by GlobalExceptionHandler
    @GetMapping("/schedules/parse")
    public ResponseEntity<ScheduleSpecDto> parseSchedule(@RequestParam String value) {
        Optional<ScheduleSpec> preset = registry.lookup(value);
        ScheduleSpec spec = preset.orElseGet(() -> parser.parse(value).getSpecOrThrow());
        return ResponseEntity.ok(toDto(value, spec, preset.isPresent()));
    }

    @GetMapping("/evaluate")
    public ResponseEntity<ScheduleEvaluationDto> evaluate(
            @RequestParam String schedule,
            @RequestParam(required = false) Instant at) {
        ZonedDateTime now = schedulerService.now();
        if (at != null) {
            now = at.atZone(now.getZone());
        }
        return ResponseEntity.ok(new ScheduleEvaluationDto(schedule, now, evaluator.evaluate(schedule, now)));
    }

    @PostMapping("/run")
    public ResponseEntity<SchedulerRunSummary> run(@RequestParam(required = false) Boolean dryRun) {
        SchedulerRunSummary summary = dryRun == null ? schedulerService.run() : schedulerService.run(dryRun);
        return ResponseEntity.ok(summary);
    }

    private ScheduleSpecDto toDto(String value, ScheduleSpec spec, boolean preset) {
        List<String> activeDays = spec.getDays().getDays().stream()
                .map(DaySelector::shortName)
                .collect(Collectors.toList());
        return new ScheduleSpecDto(value, spec.getDays().getExpression(), activeDays,
                spec.getStart().toString(), spec.getStop().toString(), preset);
    }
}
