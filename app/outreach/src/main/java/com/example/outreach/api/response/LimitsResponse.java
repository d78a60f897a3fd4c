package com.example.outreach.api.response;

import com.example.outreach.model.SendLimits;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LimitsResponse(
    int dailyLimit,
    int hourlyLimit,
    int recipientLimit,
    int batchLimit,
    int sentToday,
    int sentThisHour,
    int uniqueRecipientsToday,
    int remainingToday,
    double reputationScore,
    String warmupStatus,
    List<String> warnings) {

  public LimitsResponse {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static LimitsResponse from(SendLimits limits, List<String> warnings) {
    return new LimitsResponse(
        limits.dailyLimit(),
        limits.hourlyLimit(),
        limits.recipientLimit(),
        limits.batchLimit(),
        limits.sentToday(),
        limits.sentThisHour(),
        limits.uniqueToday(),
        limits.remainingToday(),
        limits.reputationScore(),
        limits.warmupStatus().value(),
        warnings);
  }
}
