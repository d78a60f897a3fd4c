package com.example.outreach.model;

import java.util.Locale;

public enum WarmupStatus {
  NEW("new"),
  WARMING("warming"),
  ACTIVE("active"),
  RESTRICTED("restricted");

  private final String value;

  WarmupStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static WarmupStatus fromValue(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("warmup_status is required");
    }
    final String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (WarmupStatus status : values()) {
      if (status.value.equals(normalized)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unsupported warmup_status: " + raw);
  }
}
