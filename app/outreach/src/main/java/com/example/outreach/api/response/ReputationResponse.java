package com.example.outreach.api.response;

import com.example.outreach.model.ReputationRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Objects;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReputationResponse(
    double score,
    int totalSent,
    int totalBounced,
    int successfulDeliveries,
    String warmupStatus,
    String lastCalculated) {

  public static ReputationResponse from(ReputationRecord reputation) {
    return new ReputationResponse(
        reputation.score(),
        reputation.totalSent(),
        reputation.totalBounced(),
        reputation.successfulDeliveries(),
        reputation.warmupStatus().value(),
        Objects.toString(reputation.lastCalculated(), null));
  }
}
