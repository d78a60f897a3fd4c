package com.example.outreach.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Picks up jobs that were still processing when the previous instance stopped.
 *
 * <p>Jobs are not leased, so {@code outreach.jobs.resume-on-startup} must be enabled on at most
 * one instance.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "outreach.jobs.resume-on-startup",
    havingValue = "true",
    matchIfMissing = true)
public class JobRecoveryRunner implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(JobRecoveryRunner.class);

  private final BatchJobService batchJobService;

  @Override
  public void run(ApplicationArguments args) {
    final int resumed = batchJobService.resumeUnfinished();
    if (resumed > 0) {
      logger.info("unfinished jobs resumed count={}", resumed);
    }
  }
}
