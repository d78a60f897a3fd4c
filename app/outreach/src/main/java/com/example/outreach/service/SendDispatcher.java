/*
 * Where: Outreach service layer
 * What: the governed send path shared by send jobs and the single-send endpoint
 * Why: sent check, quota check, delivery and the send record form one critical section per owner
 */
package com.example.outreach.service;

import com.example.outreach.api.EmailNotFoundException;
import com.example.outreach.api.InvalidEmailStateException;
import com.example.outreach.model.EmailRecord;
import com.example.outreach.model.SendDecision;
import com.example.outreach.repository.EmailRepository;
import com.google.common.util.concurrent.Striped;
import java.util.List;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SendDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(SendDispatcher.class);
  private static final int LOCK_STRIPES = 1024;

  private final SendingRateGovernor governor;
  private final MailDelivery mailDelivery;
  private final StageLifecycleService lifecycleService;
  private final EmailRepository emailRepository;
  private final OutreachMetrics metrics;
  private final Striped<Lock> ownerLocks = Striped.lazyWeakLock(LOCK_STRIPES);

  public SendDispatcher(
      SendingRateGovernor governor,
      MailDelivery mailDelivery,
      StageLifecycleService lifecycleService,
      EmailRepository emailRepository,
      OutreachMetrics metrics) {
    this.governor = governor;
    this.mailDelivery = mailDelivery;
    this.lifecycleService = lifecycleService;
    this.emailRepository = emailRepository;
    this.metrics = metrics;
  }

  /**
   * Sends one email if it is still unsent and the governor allows it. The send is marked on the
   * email before the lock is released, so a concurrent dispatch of the same email sees it as sent.
   *
   * @throws InvalidEmailStateException when the email was sent or completed in the meantime
   * @throws QuotaDeniedException when the owner's quota does not allow one more send
   * @throws DeliveryException when the transport rejects the message
   */
  public DispatchResult dispatch(EmailRecord email) {
    final String ownerId = email.ownerId();
    final Lock lock = ownerLocks.get(ownerId);
    lock.lock();
    try {
      final EmailRecord current =
          emailRepository
              .findById(email.emailId())
              .orElseThrow(() -> new EmailNotFoundException(email.emailId()));
      if (!current.isSendable()) {
        throw new InvalidEmailStateException("email " + email.emailId() + " was already sent");
      }
      final SendDecision decision = governor.canSend(ownerId, 1);
      if (!decision.allowed()) {
        metrics.recordQuotaDenied();
        throw new QuotaDeniedException(decision.reason());
      }
      final String messageId;
      try {
        messageId =
            mailDelivery.deliver(
                ownerId, current.recipientAddress(), current.subject(), current.body());
      } catch (DeliveryException ex) {
        metrics.recordDeliveryResult(ex.isTokenInvalid() ? "token_invalid" : "failed");
        throw ex;
      }
      metrics.recordDeliveryResult("sent");
      logger.info(
          "email dispatched emailId={} stage={} messageId={}",
          current.emailId(),
          current.stage().value(),
          messageId);
      final AdvanceResult advance = recordDelivered(current);
      try {
        governor.recordSend(ownerId, List.of(current.recipientAddress()), messageId);
      } catch (RuntimeException ex) {
        // Delivered and marked sent; only the quota ledger misses this send.
        logger.error(
            "quota record failed after delivery emailId={} messageId={}",
            current.emailId(),
            messageId,
            ex);
      }
      return new DispatchResult(messageId, decision.warning(), advance);
    } finally {
      lock.unlock();
    }
  }

  private AdvanceResult recordDelivered(EmailRecord email) {
    try {
      return lifecycleService.advance(email);
    } catch (RuntimeException ex) {
      logger.error("stage advance failed after delivery emailId={}", email.emailId(), ex);
      return new AdvanceResult(email, null, false, false, "send not recorded: " + ex.getMessage());
    }
  }
}
