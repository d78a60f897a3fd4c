package com.example.outreach.api.response;

import com.example.outreach.model.EmailRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Objects;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmailResponse(
    UUID emailId,
    String recipientAddress,
    String recipientName,
    String recipientCompany,
    String subject,
    String body,
    String stage,
    String status,
    UUID groupId,
    UUID templateId,
    String createdAt,
    String sentAt,
    String followupDueAt,
    String lastchanceDueAt) {

  public static EmailResponse from(EmailRecord email) {
    return new EmailResponse(
        email.emailId(),
        email.recipientAddress(),
        email.recipientName(),
        email.recipientCompany(),
        email.subject(),
        email.body(),
        email.stage().value(),
        email.status().value(),
        email.groupId(),
        email.templateId(),
        Objects.toString(email.createdAt(), null),
        Objects.toString(email.sentAt(), null),
        Objects.toString(email.followupDueAt(), null),
        Objects.toString(email.lastchanceDueAt(), null));
  }
}
