package com.example.outreach.model;

import java.time.Instant;
import java.time.LocalDate;

/** Per owner and calendar day send counters. */
public record QuotaRecord(
    String ownerId, LocalDate day, int emailsSent, int uniqueRecipients, Instant lastUpdated) {

  public static QuotaRecord empty(String ownerId, LocalDate day) {
    return new QuotaRecord(ownerId, day, 0, 0, null);
  }
}
