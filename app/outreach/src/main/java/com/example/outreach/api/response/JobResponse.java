package com.example.outreach.api.response;

import com.example.outreach.model.JobRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResponse(
    UUID jobId,
    String kind,
    String status,
    String stage,
    UUID groupId,
    int totalItems,
    int processedItems,
    int successCount,
    int failureCount,
    boolean paused,
    String errorMessage,
    String warningMessage,
    String createdAt,
    String updatedAt) {

  public static JobResponse from(JobRecord job) {
    return new JobResponse(
        job.jobId(),
        job.kind().name().toLowerCase(Locale.ROOT),
        job.status().name().toLowerCase(Locale.ROOT),
        job.stage().value(),
        job.groupId(),
        job.totalItems(),
        job.processedItems(),
        job.successCount(),
        job.failureCount(),
        job.paused(),
        job.errorMessage(),
        job.warningMessage(),
        Objects.toString(job.createdAt(), null),
        Objects.toString(job.updatedAt(), null));
  }
}
