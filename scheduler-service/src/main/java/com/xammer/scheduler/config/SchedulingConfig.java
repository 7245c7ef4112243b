package com.xammer.scheduler.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the periodic scheduler pass.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
