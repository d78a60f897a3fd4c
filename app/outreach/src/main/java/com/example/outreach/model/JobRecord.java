/*
 * Where: Outreach domain model
 * What: a unit of asynchronous batch work and its durable progress counters
 * Why: clients recover full progress by re-reading this record
 */
package com.example.outreach.model;

import java.time.Instant;
import java.util.UUID;

public record JobRecord(
    UUID jobId,
    String ownerId,
    JobKind kind,
    UUID groupId,
    EmailStage stage,
    UUID templateId,
    boolean avoidDuplicates,
    boolean includeCollaborators,
    int totalItems,
    int processedItems,
    int successCount,
    JobStatus status,
    boolean paused,
    String errorMessage,
    String warningMessage,
    Instant createdAt,
    Instant updatedAt) {

  public int failureCount() {
    return processedItems - successCount;
  }

  public static JobRecord start(
      String ownerId,
      JobKind kind,
      UUID groupId,
      EmailStage stage,
      UUID templateId,
      DedupeOptions dedupeOptions,
      int totalItems,
      Instant now) {
    return new JobRecord(
        UUID.randomUUID(),
        ownerId,
        kind,
        groupId,
        stage,
        templateId,
        dedupeOptions.avoidDuplicates(),
        dedupeOptions.includeCollaborators(),
        totalItems,
        0,
        0,
        JobStatus.PROCESSING,
        false,
        null,
        null,
        now,
        now);
  }
}
