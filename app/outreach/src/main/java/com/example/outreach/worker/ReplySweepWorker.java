package com.example.outreach.worker;

import com.example.outreach.service.ReplySweepService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "outreach.reply-sweep.enabled", havingValue = "true")
public class ReplySweepWorker {

  private final ReplySweepService replySweepService;

  @Scheduled(fixedDelayString = "${outreach.reply-sweep.interval}")
  public void run() {
    replySweepService.sweep();
  }
}
