/*
 * Where: Outreach service layer
 * What: owner-facing listing and maintenance of individual emails
 * Why: unsent drafts are editable while sent emails only move through the lifecycle
 */
package com.example.outreach.service;

import com.example.outreach.api.EmailNotFoundException;
import com.example.outreach.api.InvalidEmailStateException;
import com.example.outreach.model.CompletionRecord;
import com.example.outreach.model.EmailRecord;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailStatus;
import com.example.outreach.repository.CompletionRepository;
import com.example.outreach.repository.EmailRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EmailService {

  private static final Logger logger = LoggerFactory.getLogger(EmailService.class);

  private final EmailRepository emailRepository;
  private final CompletionRepository completionRepository;
  private final SendDispatcher sendDispatcher;
  private final StageLifecycleService lifecycleService;

  public List<EmailRecord> list(String ownerId, EmailStage stage, UUID groupId) {
    return emailRepository.findByOwner(ownerId, stage, groupId);
  }

  public EmailRecord get(String ownerId, UUID emailId) {
    return emailRepository
        .findByIdAndOwner(emailId, ownerId)
        .orElseThrow(() -> new EmailNotFoundException(emailId));
  }

  /** Moves an unsent email between draft and the due state of its stage. */
  public EmailRecord updateStatus(String ownerId, UUID emailId, EmailStatus status) {
    final EmailRecord email = get(ownerId, emailId);
    if (!email.isSendable()) {
      throw new InvalidEmailStateException("email " + emailId + " was already sent");
    }
    if (status != EmailStatus.DRAFT && status != email.stage().dueStatus()) {
      throw new InvalidEmailStateException(
          "status " + status.value() + " is not allowed for a " + email.stage().value()
              + " email");
    }
    if (emailRepository.updateUnsentStatus(emailId, ownerId, status) == 0) {
      throw new InvalidEmailStateException("email " + emailId + " was already sent");
    }
    return get(ownerId, emailId);
  }

  public void delete(String ownerId, UUID emailId) {
    final EmailRecord email = get(ownerId, emailId);
    if (email.isSent() || emailRepository.deleteUnsent(emailId, ownerId) == 0) {
      throw new InvalidEmailStateException("sent email " + emailId + " cannot be deleted");
    }
    logger.info("email deleted emailId={} stage={}", emailId, email.stage().value());
  }

  /**
   * Sends one email through the governed path.
   *
   * @throws QuotaDeniedException when the owner's quota is exhausted
   * @throws DeliveryException when the transport rejects the message
   */
  public DispatchResult send(String ownerId, UUID emailId) {
    final EmailRecord email = get(ownerId, emailId);
    if (!email.isSendable()) {
      throw new InvalidEmailStateException("email " + emailId + " was already sent");
    }
    return sendDispatcher.dispatch(email);
  }

  public EmailRecord regenerateNextStage(String ownerId, UUID emailId) {
    return lifecycleService.regenerateNextStage(ownerId, emailId);
  }

  public List<CompletionRecord> completions(String ownerId) {
    return completionRepository.findByOwner(ownerId);
  }
}
