package com.example.outreach.model;

public enum LimitRuleType {
  DAILY_LIMIT("daily_limit"),
  HOURLY_LIMIT("hourly_limit"),
  RECIPIENT_LIMIT("recipient_limit"),
  BATCH_LIMIT("batch_limit");

  private final String value;

  LimitRuleType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static LimitRuleType fromValue(String raw) {
    for (LimitRuleType type : values()) {
      if (type.value.equals(raw)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unsupported limit rule: " + raw);
  }
}
