package com.example.outreach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "outreach.lifecycle")
public record LifecycleProperties(
    int defaultFollowupIntervalDays, int defaultLastchanceIntervalDays) {}
