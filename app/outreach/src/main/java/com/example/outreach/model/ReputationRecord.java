package com.example.outreach.model;

import java.time.Instant;

public record ReputationRecord(
    String ownerId,
    double score,
    int totalSent,
    int totalBounced,
    int totalSpamReports,
    int successfulDeliveries,
    WarmupStatus warmupStatus,
    Instant lastCalculated) {

  public static final double INITIAL_SCORE = 5.0d;

  /** Reputation assumed for an owner that has never been recalculated. */
  public static ReputationRecord initial(String ownerId) {
    return new ReputationRecord(ownerId, INITIAL_SCORE, 0, 0, 0, 0, WarmupStatus.NEW, null);
  }
}
