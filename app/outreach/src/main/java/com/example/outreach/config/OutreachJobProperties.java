/*
 * Where: Outreach configuration binding
 * What: batch job executor and pause-wait settings
 * Why: pool sizing and poll latency differ between environments
 */
package com.example.outreach.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "outreach.jobs")
public record OutreachJobProperties(
    int executorPoolSize,
    int executorQueueCapacity,
    Duration pausePollInterval,
    int errorMessageMaxLength,
    boolean resumeOnStartup) {}
