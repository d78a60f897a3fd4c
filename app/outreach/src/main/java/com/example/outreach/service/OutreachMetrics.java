/*
 * Where: Outreach service layer
 * What: delivery, quota, generation and job outcome metrics
 * Why: quota denials and failure ratios are watched from Prometheus
 */
package com.example.outreach.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class OutreachMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "outreach.delivery.total";
  private static final String METRIC_QUOTA_DENIED_TOTAL = "outreach.quota.denied.total";
  private static final String METRIC_GENERATION_TOTAL = "outreach.generation.total";
  private static final String METRIC_JOBS_FINISHED_TOTAL = "outreach.jobs.finished.total";
  private static final String METRIC_JOBS_ACTIVE = "outreach.jobs.active";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger activeJobs = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> generationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> jobCounters = new ConcurrentHashMap<>();
  private final Counter quotaDeniedCounter;

  public OutreachMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_JOBS_ACTIVE, activeJobs, AtomicInteger::get)
        .description("Batch jobs currently running on this instance")
        .register(meterRegistry);
    this.quotaDeniedCounter =
        Counter.builder(METRIC_QUOTA_DENIED_TOTAL)
            .description("Sends refused by the sending-rate governor")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Outbound delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordGenerationResult(String result) {
    generationCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_GENERATION_TOTAL)
                    .description("Per-contact generation outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordQuotaDenied() {
    quotaDeniedCounter.increment();
  }

  public void recordJobFinished(String kind, String status) {
    jobCounters
        .computeIfAbsent(
            kind + ":" + status,
            ignored ->
                Counter.builder(METRIC_JOBS_FINISHED_TOTAL)
                    .description("Batch jobs that reached a terminal state")
                    .tags(Tags.of("kind", kind, "status", status))
                    .register(meterRegistry))
        .increment();
  }

  public void jobStarted() {
    activeJobs.incrementAndGet();
  }

  public void jobStopped() {
    activeJobs.updateAndGet(current -> Math.max(0, current - 1));
  }
}
