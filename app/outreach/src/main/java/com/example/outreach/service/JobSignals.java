/*
 * Where: Outreach job engine
 * What: in-process wake-up and cancel signals for running jobs
 * Why: a paused job wakes on resume instead of waiting out its poll interval
 */
package com.example.outreach.service;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.stereotype.Component;

@Component
public class JobSignals {

  private final ConcurrentMap<UUID, Signal> signals = new ConcurrentHashMap<>();

  public void register(UUID jobId) {
    signals.computeIfAbsent(jobId, ignored -> new Signal());
  }

  public void unregister(UUID jobId) {
    signals.remove(jobId);
  }

  /** Version to pass to {@link #await}; read it before re-reading job state. */
  public long token(UUID jobId) {
    final Signal signal = signals.get(jobId);
    return signal == null ? 0L : signal.version();
  }

  public void wake(UUID jobId) {
    final Signal signal = signals.get(jobId);
    if (signal != null) {
      signal.bump(false);
    }
  }

  public void cancel(UUID jobId) {
    final Signal signal = signals.get(jobId);
    if (signal != null) {
      signal.bump(true);
    }
  }

  public boolean isCancelled(UUID jobId) {
    final Signal signal = signals.get(jobId);
    return signal != null && signal.cancelled();
  }

  /**
   * Blocks until the job is signalled after {@code token} was read, or until {@code timeout}
   * elapses. Returns immediately when a signal already arrived.
   */
  public void await(UUID jobId, long token, Duration timeout) throws InterruptedException {
    final Signal signal = signals.get(jobId);
    if (signal == null) {
      TimeUnit.NANOSECONDS.sleep(timeout.toNanos());
      return;
    }
    signal.await(token, timeout);
  }

  private static final class Signal {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private long version;
    private boolean cancelled;

    long version() {
      lock.lock();
      try {
        return version;
      } finally {
        lock.unlock();
      }
    }

    boolean cancelled() {
      lock.lock();
      try {
        return cancelled;
      } finally {
        lock.unlock();
      }
    }

    void bump(boolean cancel) {
      lock.lock();
      try {
        version++;
        cancelled = cancelled || cancel;
        changed.signalAll();
      } finally {
        lock.unlock();
      }
    }

    void await(long token, Duration timeout) throws InterruptedException {
      long remaining = timeout.toNanos();
      lock.lock();
      try {
        while (version == token && remaining > 0) {
          remaining = changed.awaitNanos(remaining);
        }
      } finally {
        lock.unlock();
      }
    }
  }
}
