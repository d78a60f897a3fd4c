package com.example.outreach.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProgressEvent(
    UUID jobId,
    String kind,
    String status,
    int current,
    int total,
    int successCount,
    int failureCount,
    String stage) {}
