package com.example.outreach.model;

/** Which column of a {@link LimitRule} applies to an owner. */
public enum LimitTier {
  WARMUP,
  DEFAULT,
  MAX
}
