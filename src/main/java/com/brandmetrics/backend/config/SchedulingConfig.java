package com.brandmetrics.backend.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the in-process refresh schedule. Off by default, since refreshes
 * are normally driven by an external trigger calling the refresh endpoint.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "refresher.schedule.enabled", havingValue = "true")
public class SchedulingConfig {
}
