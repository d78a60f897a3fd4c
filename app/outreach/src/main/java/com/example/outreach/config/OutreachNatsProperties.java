package com.example.outreach.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Subject prefix for progress events; the owner id is appended per event. */
@ConfigurationProperties(prefix = "outreach.nats")
public record OutreachNatsProperties(String subjectPrefix) {}
