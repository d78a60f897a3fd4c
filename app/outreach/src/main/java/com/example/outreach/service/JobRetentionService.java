/*
 * Where: Outreach service layer
 * What: applies the retention policy to finished jobs
 * Why: the jobs table keeps item payloads and must not grow without bound
 */
package com.example.outreach.service;

import com.example.outreach.config.OutreachRetentionProperties;
import com.example.outreach.repository.JobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(JobRetentionService.class);

  private final JobRepository jobRepository;
  private final OutreachRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int staleProcessing = jobRepository.countStaleProcessing(threshold);
    if (staleProcessing > 0) {
      logger.error(
          "job retention found stale processing jobs count={} threshold={}",
          staleProcessing,
          threshold);
    }
    final int deleted = jobRepository.deleteTerminalOlderThan(threshold);
    logger.info("job retention cleanup deleted jobs={} threshold={}", deleted, threshold);
  }
}
