package com.example.outreach.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "outreach.reply-sweep")
public record ReplySweepProperties(boolean enabled, Duration interval, int batchSize) {}
