package com.example.outreach.api.response;

import com.example.outreach.model.SendDecision;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendCheckResponse(boolean allowed, String reason, String warning) {

  public static SendCheckResponse from(SendDecision decision) {
    return new SendCheckResponse(decision.allowed(), decision.reason(), decision.warning());
  }
}
