package com.example.outreach.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class JobSignalsTest {

  private final JobSignals signals = new JobSignals();

  @Test
  void wakeReleasesAWaitingJobBeforeTheTimeout() throws Exception {
    final UUID jobId = UUID.randomUUID();
    signals.register(jobId);
    final long token = signals.token(jobId);
    final CountDownLatch released = new CountDownLatch(1);
    final Thread waiter =
        new Thread(
            () -> {
              try {
                signals.await(jobId, token, Duration.ofSeconds(30));
                released.countDown();
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
              }
            });
    waiter.start();

    signals.wake(jobId);

    assertThat(released.await(5, TimeUnit.SECONDS)).isTrue();
    waiter.join(5_000);
    assertThat(signals.isCancelled(jobId)).isFalse();
  }

  @Test
  void signalArrivingBeforeAwaitIsNotLost() throws Exception {
    final UUID jobId = UUID.randomUUID();
    signals.register(jobId);
    final long token = signals.token(jobId);
    signals.wake(jobId);

    final long started = System.nanoTime();
    signals.await(jobId, token, Duration.ofSeconds(30));

    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
  }

  @Test
  void cancelIsStickyUntilUnregistered() {
    final UUID jobId = UUID.randomUUID();
    signals.register(jobId);

    signals.cancel(jobId);
    signals.wake(jobId);
    assertThat(signals.isCancelled(jobId)).isTrue();

    signals.unregister(jobId);
    assertThat(signals.isCancelled(jobId)).isFalse();
    assertThat(signals.token(jobId)).isZero();
  }

  @Test
  void signalsForUnknownJobsAreIgnored() {
    final UUID jobId = UUID.randomUUID();

    signals.wake(jobId);
    signals.cancel(jobId);

    assertThat(signals.isCancelled(jobId)).isFalse();
  }
}
