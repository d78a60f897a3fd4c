/*
 * Where: Outreach reputation worker
 * What: recomputes reputation and warm-up status for owners that sent recently
 * Why: quota tiers follow the latest score without a manual recalculation
 */
package com.example.outreach.worker;

import com.example.outreach.service.SendingRateGovernor;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "outreach.governor.recalculation-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ReputationRecalculationWorker {

  private static final Logger logger = LoggerFactory.getLogger(ReputationRecalculationWorker.class);

  private final SendingRateGovernor governor;

  @Scheduled(fixedDelayString = "${outreach.governor.recalculation-interval}")
  public void run() {
    int recalculated = 0;
    for (String ownerId : governor.ownersInWindow()) {
      try {
        governor.recalculateReputation(ownerId);
        recalculated++;
      } catch (RuntimeException ex) {
        logger.warn("reputation recalculation failed ownerId={}", ownerId, ex);
      }
    }
    logger.info("reputation recalculation finished owners={}", recalculated);
  }
}
