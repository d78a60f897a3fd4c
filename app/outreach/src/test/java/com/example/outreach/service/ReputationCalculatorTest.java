package com.example.outreach.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.example.outreach.model.WarmupStatus;
import org.junit.jupiter.api.Test;

class ReputationCalculatorTest {

  @Test
  void activeOwnerWithFewBouncesScoresSevenAndAHalf() {
    // base 5.0, +1.0 for 25 active days, +1.5 for >100 sent with <5 bounces
    assertThat(ReputationCalculator.score(25, 200, 3)).isCloseTo(7.5d, within(1e-9));
    assertThat(ReputationCalculator.nextWarmupStatus(WarmupStatus.NEW, 25, 200))
        .isEqualTo(WarmupStatus.WARMING);
  }

  @Test
  void ownerWithoutHistoryKeepsBaseScore() {
    assertThat(ReputationCalculator.score(0, 0, 0)).isCloseTo(5.0d, within(1e-9));
  }

  @Test
  void bounceRateAboveTenPercentCostsTwoPoints() {
    // base 5.0, +0.5 for 10 active days, -2.0 for 12% bounces, no volume bonus at 100 sent
    assertThat(ReputationCalculator.score(10, 100, 12)).isCloseTo(3.5d, within(1e-9));
  }

  @Test
  void bounceRateAboveFivePercentCostsOnePoint() {
    assertThat(ReputationCalculator.bounceRate(200, 12)).isCloseTo(6.0d, within(1e-9));
    assertThat(ReputationCalculator.score(0, 200, 12)).isCloseTo(4.0d, within(1e-9));
  }

  @Test
  void bounceRateOfExactlyFivePercentIsNotPenalised() {
    assertThat(ReputationCalculator.score(0, 100, 5)).isCloseTo(5.0d, within(1e-9));
  }

  @Test
  void warmupStatusFollowsActivityThresholds() {
    assertThat(ReputationCalculator.nextWarmupStatus(WarmupStatus.WARMING, 30, 500))
        .isEqualTo(WarmupStatus.ACTIVE);
    assertThat(ReputationCalculator.nextWarmupStatus(WarmupStatus.NEW, 7, 100))
        .isEqualTo(WarmupStatus.WARMING);
    assertThat(ReputationCalculator.nextWarmupStatus(WarmupStatus.NEW, 6, 100))
        .isEqualTo(WarmupStatus.NEW);
    assertThat(ReputationCalculator.nextWarmupStatus(WarmupStatus.ACTIVE, 2, 10))
        .isEqualTo(WarmupStatus.ACTIVE);
  }
}
