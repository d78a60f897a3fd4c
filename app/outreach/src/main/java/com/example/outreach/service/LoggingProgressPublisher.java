package com.example.outreach.service;

import com.example.outreach.model.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Used when NATS is disabled; progress stays observable through the job record. */
@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingProgressPublisher implements ProgressPublisher {

  private static final Logger logger = LoggerFactory.getLogger(LoggingProgressPublisher.class);

  @Override
  public void publish(String ownerId, ProgressEvent event) {
    logger.debug(
        "job progress ownerId={} jobId={} current={} total={}",
        ownerId,
        event.jobId(),
        event.current(),
        event.total());
  }
}
