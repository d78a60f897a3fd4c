package com.example.outreach.service;

import com.example.outreach.model.JobRecord;
import com.example.outreach.model.JobStatus;
import com.example.outreach.model.ProgressEvent;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Fire-and-forget progress reporting; a failing sink never fails the job. */
@Component
@RequiredArgsConstructor
public class JobProgressReporter {

  private static final Logger logger = LoggerFactory.getLogger(JobProgressReporter.class);

  private final ProgressPublisher publisher;

  public void report(JobRecord job, int processed, int success, JobStatus status) {
    final ProgressEvent event =
        new ProgressEvent(
            job.jobId(),
            job.kind().name().toLowerCase(Locale.ROOT),
            status.name().toLowerCase(Locale.ROOT),
            processed,
            job.totalItems(),
            success,
            processed - success,
            job.stage().value());
    try {
      publisher.publish(job.ownerId(), event);
    } catch (RuntimeException ex) {
      logger.warn("progress publish failed jobId={} current={}", job.jobId(), processed, ex);
    }
  }
}
