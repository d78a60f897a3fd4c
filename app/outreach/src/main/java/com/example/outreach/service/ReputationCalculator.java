package com.example.outreach.service;

import com.example.outreach.model.WarmupStatus;

/**
 * Reputation arithmetic over a trailing window.
 *
 * <p>Thresholds are inclusive where stated as "at least" and exclusive where stated as "more
 * than"; the bounce rate is {@code bounced / totalSent * 100}.
 */
public final class ReputationCalculator {

  static final double BASE_SCORE = 5.0d;
  static final double MIN_SCORE = 0.0d;
  static final double MAX_SCORE = 10.0d;

  private ReputationCalculator() {}

  public static double score(int activeDays, int totalSent, int bounced) {
    double score = BASE_SCORE;
    if (activeDays >= 20) {
      score += 1.0d;
    } else if (activeDays >= 10) {
      score += 0.5d;
    }
    final double bounceRate = bounceRate(totalSent, bounced);
    if (bounceRate > 10.0d) {
      score -= 2.0d;
    } else if (bounceRate > 5.0d) {
      score -= 1.0d;
    }
    if (totalSent > 100 && bounced < 5) {
      score += 1.5d;
    }
    return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
  }

  public static double bounceRate(int totalSent, int bounced) {
    if (totalSent <= 0) {
      return 0.0d;
    }
    return bounced * 100.0d / totalSent;
  }

  /** Promotes to warming or active when the thresholds are met; otherwise keeps the current status. */
  public static WarmupStatus nextWarmupStatus(
      WarmupStatus current, int activeDays, int totalSent) {
    if (activeDays >= 30 && totalSent >= 500) {
      return WarmupStatus.ACTIVE;
    }
    if (activeDays >= 7 && totalSent >= 100) {
      return WarmupStatus.WARMING;
    }
    return current;
  }
}
