/*
 * Where: Outreach service layer
 * What: stage transitions of a recipient's emails and their side effects
 * Why: a send must be recorded once even if spawning the next stage fails
 */
package com.example.outreach.service;

import com.example.outreach.api.EmailNotFoundException;
import com.example.outreach.api.InvalidEmailStateException;
import com.example.outreach.api.PreconditionFailedException;
import com.example.outreach.api.TemplateNotFoundException;
import com.example.outreach.config.LifecycleProperties;
import com.example.outreach.model.CompletionRecord;
import com.example.outreach.model.Contact;
import com.example.outreach.model.EmailRecord;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailStatus;
import com.example.outreach.model.EmailTemplate;
import com.example.outreach.model.GeneratedContent;
import com.example.outreach.model.OwnerProfile;
import com.example.outreach.repository.CompletionRepository;
import com.example.outreach.repository.EmailRepository;
import com.example.outreach.repository.OwnerProfileRepository;
import com.example.outreach.repository.TemplateRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class StageLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(StageLifecycleService.class);

  private final EmailRepository emailRepository;
  private final CompletionRepository completionRepository;
  private final TemplateRepository templateRepository;
  private final OwnerProfileRepository profileRepository;
  private final ContentGenerator contentGenerator;
  private final LifecycleProperties properties;
  private final Clock clock;
  private final TransactionTemplate transactionTemplate;

  public StageLifecycleService(
      EmailRepository emailRepository,
      CompletionRepository completionRepository,
      TemplateRepository templateRepository,
      OwnerProfileRepository profileRepository,
      ContentGenerator contentGenerator,
      LifecycleProperties properties,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.emailRepository = emailRepository;
    this.completionRepository = completionRepository;
    this.templateRepository = templateRepository;
    this.profileRepository = profileRepository;
    this.contentGenerator = contentGenerator;
    this.properties = properties;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * Records a successful dispatch of {@code email}. Calling it again for an email that is already
   * sent returns the stored state without side effects.
   */
  public AdvanceResult advance(EmailRecord email) {
    final Instant now = Instant.now(clock);
    final OwnerProfile profile = profileRepository.find(email.ownerId()).orElse(null);
    final Instant followupDueAt;
    final Instant lastchanceDueAt;
    switch (email.stage()) {
      case OUTREACH -> {
        followupDueAt = now.plus(Duration.ofDays(followupIntervalDays(profile)));
        lastchanceDueAt = now.plus(Duration.ofDays(lastchanceIntervalDays(profile)));
      }
      case FOLLOWUP -> {
        followupDueAt = null;
        lastchanceDueAt =
            email.lastchanceDueAt() != null
                ? email.lastchanceDueAt()
                : now.plus(
                    Duration.ofDays(
                        lastchanceIntervalDays(profile) - followupIntervalDays(profile)));
      }
      default -> {
        followupDueAt = null;
        lastchanceDueAt = null;
      }
    }
    final EmailStatus sentStatus = email.stage().sentStatus();
    final int updated =
        emailRepository.markSent(
            email.emailId(), now, sentStatus, followupDueAt, lastchanceDueAt);
    if (updated == 0) {
      logger.info(
          "advance skipped; email already sent emailId={} stage={}",
          email.emailId(),
          email.stage().value());
      return AdvanceResult.noop(emailRepository.findById(email.emailId()).orElse(null));
    }
    final EmailRecord sent =
        withSent(email, now, sentStatus, followupDueAt, lastchanceDueAt);
    if (email.stage() == EmailStage.LASTCHANCE) {
      final boolean purged = completeRecipient(sent.ownerId(), sent.recipientAddress(), false);
      return new AdvanceResult(purged ? null : sent, null, false, purged, null);
    }
    try {
      final EmailRecord next = createNextStage(sent, profile, now);
      return new AdvanceResult(sent, next, false, false, null);
    } catch (RuntimeException ex) {
      // The send stays recorded; the next stage can be regenerated later.
      logger.warn(
          "next stage generation failed emailId={} stage={}",
          sent.emailId(),
          sent.stage().value(),
          ex);
      return new AdvanceResult(sent, null, false, false, ex.getMessage());
    }
  }

  /**
   * Archives the recipient and deletes all of their emails when every email is completed.
   * Returns false when some email is still open.
   */
  public boolean cleanup(String ownerId, String recipientAddress) {
    final Boolean purged =
        transactionTemplate.execute(status -> purgeIfCompleted(ownerId, recipientAddress));
    return Boolean.TRUE.equals(purged);
  }

  /** Closes every email of a recipient who replied and archives them. */
  public boolean completeReplied(String ownerId, String recipientAddress) {
    return completeRecipient(ownerId, recipientAddress, true);
  }

  /** Recreates the next-stage email of a sent email when it is missing. */
  public EmailRecord regenerateNextStage(String ownerId, UUID emailId) {
    final EmailRecord email =
        emailRepository
            .findByIdAndOwner(emailId, ownerId)
            .orElseThrow(() -> new EmailNotFoundException(emailId));
    if (!email.isSent()) {
      throw new InvalidEmailStateException("email " + emailId + " has not been sent");
    }
    final EmailStage next =
        email
            .stage()
            .next()
            .orElseThrow(
                () -> new InvalidEmailStateException("last chance emails have no next stage"));
    if (emailRepository.existsActive(ownerId, email.recipientAddress(), next)) {
      throw new InvalidEmailStateException(
          "a " + next.value() + " email already exists for this recipient");
    }
    final OwnerProfile profile = profileRepository.find(ownerId).orElse(null);
    return createNextStage(email, profile, Instant.now(clock));
  }

  @VisibleForTesting
  EmailRecord createNextStage(EmailRecord sent, OwnerProfile profile, Instant now) {
    final EmailStage next =
        sent.stage()
            .next()
            .orElseThrow(() -> new IllegalStateException("no stage after " + sent.stage().value()));
    if (profile == null) {
      throw new PreconditionFailedException("owner profile is missing");
    }
    final EmailTemplate template =
        templateRepository
            .findDefault(sent.ownerId(), next)
            .orElseThrow(
                () -> new TemplateNotFoundException("no default template for " + next.category()));
    final GeneratedContent content =
        contentGenerator.generate(Contact.fromEmail(sent), profile, template, next);
    final EmailRecord nextEmail =
        new EmailRecord(
            UUID.randomUUID(),
            sent.ownerId(),
            sent.recipientAddress(),
            sent.recipientName(),
            sent.recipientCompany(),
            content.subject(),
            content.body(),
            next,
            EmailStatus.DRAFT,
            sent.groupId(),
            now,
            null,
            sent.followupDueAt(),
            sent.lastchanceDueAt(),
            template.templateId());
    emailRepository.insert(nextEmail);
    logger.info(
        "next stage created emailId={} previousEmailId={} stage={}",
        nextEmail.emailId(),
        sent.emailId(),
        next.value());
    return nextEmail;
  }

  private boolean completeRecipient(String ownerId, String recipientAddress, boolean includeUnsent) {
    try {
      final Boolean purged =
          transactionTemplate.execute(
              status -> {
                if (includeUnsent) {
                  emailRepository.completeAll(ownerId, recipientAddress);
                } else {
                  emailRepository.completeSent(ownerId, recipientAddress);
                }
                return purgeIfCompleted(ownerId, recipientAddress);
              });
      return Boolean.TRUE.equals(purged);
    } catch (DataAccessException ex) {
      // The send itself is already committed; cleanup can be retried.
      logger.warn("recipient cleanup failed ownerId={}", ownerId, ex);
      return false;
    }
  }

  private boolean purgeIfCompleted(String ownerId, String recipientAddress) {
    final List<EmailRecord> emails = emailRepository.findByRecipient(ownerId, recipientAddress);
    if (emails.isEmpty()) {
      return false;
    }
    final boolean allCompleted =
        emails.stream().allMatch(email -> email.status() == EmailStatus.COMPLETED);
    if (!allCompleted) {
      logger.info("cleanup deferred; recipient has open emails ownerId={}", ownerId);
      return false;
    }
    final String recipientName = emails.get(emails.size() - 1).recipientName();
    completionRepository.insertIfAbsent(
        new CompletionRecord(ownerId, recipientAddress, recipientName, Instant.now(clock)));
    final int deleted = emailRepository.deleteByRecipient(ownerId, recipientAddress);
    logger.info("recipient archived ownerId={} deletedEmails={}", ownerId, deleted);
    return true;
  }

  private long followupIntervalDays(OwnerProfile profile) {
    if (profile != null && profile.followupIntervalDays() != null) {
      return profile.followupIntervalDays();
    }
    return properties.defaultFollowupIntervalDays();
  }

  private long lastchanceIntervalDays(OwnerProfile profile) {
    if (profile != null && profile.lastchanceIntervalDays() != null) {
      return profile.lastchanceIntervalDays();
    }
    return properties.defaultLastchanceIntervalDays();
  }

  private static EmailRecord withSent(
      EmailRecord email,
      Instant sentAt,
      EmailStatus status,
      Instant followupDueAt,
      Instant lastchanceDueAt) {
    return new EmailRecord(
        email.emailId(),
        email.ownerId(),
        email.recipientAddress(),
        email.recipientName(),
        email.recipientCompany(),
        email.subject(),
        email.body(),
        email.stage(),
        status,
        email.groupId(),
        email.createdAt(),
        sentAt,
        followupDueAt != null ? followupDueAt : email.followupDueAt(),
        lastchanceDueAt != null ? lastchanceDueAt : email.lastchanceDueAt(),
        email.templateId());
  }
}
