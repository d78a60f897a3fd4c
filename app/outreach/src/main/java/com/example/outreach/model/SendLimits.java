package com.example.outreach.model;

/** Snapshot of an owner's quota position, computed per call. */
public record SendLimits(
    int dailyLimit,
    int hourlyLimit,
    int recipientLimit,
    int batchLimit,
    int sentToday,
    int sentThisHour,
    int uniqueToday,
    double reputationScore,
    WarmupStatus warmupStatus) {

  public int remainingToday() {
    return Math.max(0, dailyLimit - sentToday);
  }

  public int remainingThisHour() {
    return Math.max(0, hourlyLimit - sentThisHour);
  }

  public int remainingRecipients() {
    return Math.max(0, recipientLimit - uniqueToday);
  }
}
