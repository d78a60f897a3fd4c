package com.example.outreach.model;

public record LimitRule(LimitRuleType ruleType, int defaultValue, int warmupValue, int maxValue) {

  public int valueFor(LimitTier tier) {
    return switch (tier) {
      case WARMUP -> warmupValue;
      case DEFAULT -> defaultValue;
      case MAX -> maxValue;
    };
  }
}
