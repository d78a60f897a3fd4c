/*
 * Where: Outreach domain model
 * What: one outreach artifact per (owner, recipient, stage)
 * Why: carries the stage/status pair the lifecycle engine transitions
 */
package com.example.outreach.model;

import java.time.Instant;
import java.util.UUID;

public record EmailRecord(
    UUID emailId,
    String ownerId,
    String recipientAddress,
    String recipientName,
    String recipientCompany,
    String subject,
    String body,
    EmailStage stage,
    EmailStatus status,
    UUID groupId,
    Instant createdAt,
    Instant sentAt,
    Instant followupDueAt,
    Instant lastchanceDueAt,
    UUID templateId) {

  public boolean isSent() {
    return sentAt != null;
  }

  public boolean isSendable() {
    return sentAt == null && status != EmailStatus.COMPLETED;
  }
}
