/*
 * Where: Outreach configuration binding
 * What: retention settings for finished jobs
 * Why: keep the jobs table bounded with a per-environment policy
 */
package com.example.outreach.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "outreach.retention")
public record OutreachRetentionProperties(
    boolean enabled, int retentionDays, Duration cleanupInterval) {}
