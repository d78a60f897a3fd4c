package com.example.outreach.service;

import com.example.outreach.config.ReplySweepProperties;
import com.example.outreach.model.EmailRecord;
import com.example.outreach.repository.EmailRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Closes the chain of recipients who answered a sent email. */
@Service
@RequiredArgsConstructor
public class ReplySweepService {

  private static final Logger logger = LoggerFactory.getLogger(ReplySweepService.class);

  private final EmailRepository emailRepository;
  private final ReplyDetector replyDetector;
  private final StageLifecycleService lifecycleService;
  private final ReplySweepProperties properties;

  /** Returns the number of recipients that were completed. */
  public int sweep() {
    int completed = 0;
    for (EmailRecord email : emailRepository.findAwaitingReply(properties.batchSize())) {
      try {
        if (!replyDetector.hasReplied(email.ownerId(), email)) {
          continue;
        }
        if (lifecycleService.completeReplied(email.ownerId(), email.recipientAddress())) {
          completed++;
        }
      } catch (RuntimeException ex) {
        logger.warn(
            "reply check failed emailId={} ownerId={}", email.emailId(), email.ownerId(), ex);
      }
    }
    if (completed > 0) {
      logger.info("reply sweep completed recipients={}", completed);
    }
    return completed;
  }
}
