package com.example.outreach.api.response;

import com.example.outreach.service.AdvanceResult;
import com.example.outreach.service.DispatchResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendEmailResponse(
    UUID emailId,
    String messageId,
    String status,
    UUID nextStageEmailId,
    boolean completed,
    String quotaWarning,
    String nextStageError) {

  public static SendEmailResponse from(UUID emailId, DispatchResult result) {
    final AdvanceResult advance = result.advance();
    return new SendEmailResponse(
        emailId,
        result.messageId(),
        advance.email() == null ? "completed" : advance.email().status().value(),
        advance.nextStageEmail() == null ? null : advance.nextStageEmail().emailId(),
        advance.completed(),
        result.quotaWarning(),
        advance.nextStageError());
  }
}
