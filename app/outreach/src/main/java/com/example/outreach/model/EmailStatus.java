package com.example.outreach.model;

import java.util.Locale;

public enum EmailStatus {
  DRAFT("draft"),
  OUTREACH_PENDING("outreach_pending"),
  FOLLOWUP_DUE("followup_due"),
  LASTCHANCE_DUE("lastchance_due"),
  COMPLETED("completed");

  private final String value;

  EmailStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static EmailStatus fromValue(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("status is required");
    }
    final String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (EmailStatus status : values()) {
      if (status.value.equals(normalized)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unsupported status: " + raw);
  }
}
