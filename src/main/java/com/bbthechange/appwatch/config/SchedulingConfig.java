package com.bbthechange.appwatch.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the periodic release check. Disable with monitor.scheduler.enabled=false.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "monitor.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
