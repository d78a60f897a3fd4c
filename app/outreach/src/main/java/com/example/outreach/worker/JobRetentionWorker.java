package com.example.outreach.worker;

import com.example.outreach.service.JobRetentionService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "outreach.retention.enabled", havingValue = "true")
public class JobRetentionWorker {

  private final JobRetentionService retentionService;

  @Scheduled(fixedDelayString = "${outreach.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
