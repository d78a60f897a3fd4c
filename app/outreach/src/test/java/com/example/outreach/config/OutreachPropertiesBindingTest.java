package com.example.outreach.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class OutreachPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "outreach.jobs.executor-pool-size=4",
              "outreach.jobs.executor-queue-capacity=100",
              "outreach.jobs.pause-poll-interval=1s",
              "outreach.jobs.error-message-max-length=1000",
              "outreach.jobs.resume-on-startup=true",
              "outreach.governor.low-remaining-threshold=50",
              "outreach.governor.low-reputation-threshold=3.0",
              "outreach.governor.reputation-window-days=30",
              "outreach.governor.recalculation-enabled=true",
              "outreach.governor.recalculation-interval=1h",
              "outreach.lifecycle.default-followup-interval-days=3",
              "outreach.lifecycle.default-lastchance-interval-days=6",
              "outreach.retention.enabled=true",
              "outreach.retention.retention-days=30",
              "outreach.retention.cleanup-interval=6h",
              "outreach.reply-sweep.enabled=false",
              "outreach.reply-sweep.interval=30m",
              "outreach.reply-sweep.batch-size=200");

  @Test
  void bindsDurationsAndLeavesWarmupOverrideUnset() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final OutreachJobProperties jobs = context.getBean(OutreachJobProperties.class);
          final GovernorProperties governor = context.getBean(GovernorProperties.class);
          final LifecycleProperties lifecycle = context.getBean(LifecycleProperties.class);
          final OutreachRetentionProperties retention =
              context.getBean(OutreachRetentionProperties.class);
          final ReplySweepProperties replySweep = context.getBean(ReplySweepProperties.class);

          assertThat(jobs.pausePollInterval()).isEqualTo(Duration.ofSeconds(1));
          assertThat(jobs.executorPoolSize()).isEqualTo(4);
          assertThat(governor.recalculationInterval()).isEqualTo(Duration.ofHours(1));
          assertThat(governor.lowReputationThreshold()).isEqualTo(3.0d);
          assertThat(governor.warmupDailyLimitOverride()).isNull();
          assertThat(lifecycle.defaultLastchanceIntervalDays()).isEqualTo(6);
          assertThat(retention.cleanupInterval()).isEqualTo(Duration.ofHours(6));
          assertThat(replySweep.interval()).isEqualTo(Duration.ofMinutes(30));
          assertThat(replySweep.batchSize()).isEqualTo(200);
        });
  }

  @Test
  void bindsWarmupOverride() {
    contextRunner
        .withPropertyValues("outreach.governor.warmup-daily-limit-override=20")
        .run(
            context ->
                assertThat(context.getBean(GovernorProperties.class).warmupDailyLimitOverride())
                    .isEqualTo(20));
  }

  @Configuration
  @EnableConfigurationProperties({
    OutreachJobProperties.class,
    GovernorProperties.class,
    LifecycleProperties.class,
    OutreachRetentionProperties.class,
    ReplySweepProperties.class
  })
  static class TestConfiguration {}
}
