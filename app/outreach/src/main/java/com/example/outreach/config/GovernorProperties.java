package com.example.outreach.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sending-rate governor tunables.
 *
 * <p>{@code warmupDailyLimitOverride} replaces the warm-up daily limit of the rule table when set.
 */
@ConfigurationProperties(prefix = "outreach.governor")
public record GovernorProperties(
    int lowRemainingThreshold,
    double lowReputationThreshold,
    int reputationWindowDays,
    Integer warmupDailyLimitOverride,
    boolean recalculationEnabled,
    Duration recalculationInterval) {}
