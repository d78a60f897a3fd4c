/*
 * Where: Outreach job engine
 * What: executes generation and send jobs item by item with durable checkpoints
 * Why: a job survives pauses, cancels and restarts without redoing finished items
 */
package com.example.outreach.service;

import com.example.outreach.api.EmailNotFoundException;
import com.example.outreach.api.InvalidEmailStateException;
import com.example.outreach.api.PreconditionFailedException;
import com.example.outreach.api.TemplateNotFoundException;
import com.example.outreach.config.OutreachJobProperties;
import com.example.outreach.model.Contact;
import com.example.outreach.model.EmailRecord;
import com.example.outreach.model.EmailStatus;
import com.example.outreach.model.EmailTemplate;
import com.example.outreach.model.GeneratedContent;
import com.example.outreach.model.JobKind;
import com.example.outreach.model.JobRecord;
import com.example.outreach.model.JobStatus;
import com.example.outreach.model.OwnerProfile;
import com.example.outreach.repository.EmailRepository;
import com.example.outreach.repository.JobRepository;
import com.example.outreach.repository.OwnerProfileRepository;
import com.example.outreach.repository.TemplateRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

@Component
public class JobRunner {

  private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);
  static final String TOKEN_INVALID_WARNING =
      "Delivery credentials were rejected. Reconnect the sending account and resume the job.";

  private final JobRepository jobRepository;
  private final EmailRepository emailRepository;
  private final TemplateRepository templateRepository;
  private final OwnerProfileRepository profileRepository;
  private final DeduplicationIndex deduplicationIndex;
  private final ContentGenerator contentGenerator;
  private final SendDispatcher sendDispatcher;
  private final JobSignals signals;
  private final JobProgressReporter progressReporter;
  private final JobItemCodec itemCodec;
  private final OutreachMetrics metrics;
  private final OutreachJobProperties properties;
  private final Clock clock;

  public JobRunner(
      JobRepository jobRepository,
      EmailRepository emailRepository,
      TemplateRepository templateRepository,
      OwnerProfileRepository profileRepository,
      DeduplicationIndex deduplicationIndex,
      ContentGenerator contentGenerator,
      SendDispatcher sendDispatcher,
      JobSignals signals,
      JobProgressReporter progressReporter,
      JobItemCodec itemCodec,
      OutreachMetrics metrics,
      OutreachJobProperties properties,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.emailRepository = emailRepository;
    this.templateRepository = templateRepository;
    this.profileRepository = profileRepository;
    this.deduplicationIndex = deduplicationIndex;
    this.contentGenerator = contentGenerator;
    this.sendDispatcher = sendDispatcher;
    this.signals = signals;
    this.progressReporter = progressReporter;
    this.itemCodec = itemCodec;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  /** Runs a job from its last checkpoint until it completes, fails, is cancelled or interrupted. */
  public void run(UUID jobId, String traceId) {
    final JobRecord job = jobRepository.findById(jobId).orElse(null);
    if (job == null) {
      logger.warn("job not found at start jobId={}", jobId);
      return;
    }
    if (job.status().isTerminal()) {
      logger.info("job already finished jobId={} status={}", jobId, job.status());
      return;
    }
    final String kind = job.kind().name().toLowerCase(Locale.ROOT);
    MDC.put("trace_id", traceId);
    MDC.put("job_id", jobId.toString());
    MDC.put("owner_id", job.ownerId());
    MDC.put("job_kind", kind);
    signals.register(jobId);
    metrics.jobStarted();
    try {
      logger.info(
          "job started total={} processed={} stage={}",
          job.totalItems(),
          job.processedItems(),
          job.stage().value());
      final LoopOutcome outcome =
          job.kind() == JobKind.GENERATE ? runGeneration(job) : runSend(job);
      finish(job, outcome);
    } catch (RuntimeException ex) {
      logger.error("job failed", ex);
      final int updated =
          jobRepository.markError(jobId, truncateError(ex.getMessage()), Instant.now(clock));
      if (updated > 0) {
        metrics.recordJobFinished(kind, "error");
        final JobRecord failed = jobRepository.findById(jobId).orElse(job);
        progressReporter.report(
            failed, failed.processedItems(), failed.successCount(), JobStatus.ERROR);
      }
    } finally {
      metrics.jobStopped();
      signals.unregister(jobId);
      MDC.remove("job_kind");
      MDC.remove("owner_id");
      MDC.remove("job_id");
      MDC.remove("trace_id");
    }
  }

  private void finish(JobRecord job, LoopOutcome outcome) {
    final String kind = job.kind().name().toLowerCase(Locale.ROOT);
    if (outcome.exhausted() && jobRepository.markCompleted(job.jobId(), Instant.now(clock)) > 0) {
      metrics.recordJobFinished(kind, "completed");
      progressReporter.report(job, outcome.processed(), outcome.success(), JobStatus.COMPLETED);
      logger.info(
          "job completed processed={} success={}", outcome.processed(), outcome.success());
      return;
    }
    final JobRecord current = jobRepository.findById(job.jobId()).orElse(null);
    if (current == null) {
      logger.warn("job disappeared while running");
      return;
    }
    if (current.status() == JobStatus.PROCESSING) {
      // Interrupted; the checkpoint stays and the job resumes on the next startup.
      logger.warn("job stopped before completion processed={}", current.processedItems());
      return;
    }
    metrics.recordJobFinished(kind, current.status().name().toLowerCase(Locale.ROOT));
    progressReporter.report(
        current, current.processedItems(), current.successCount(), current.status());
    logger.info(
        "job stopped status={} processed={} success={}",
        current.status(),
        current.processedItems(),
        current.successCount());
  }

  private LoopOutcome runGeneration(JobRecord job) {
    final List<Contact> contacts = itemCodec.readContacts(loadItems(job));
    final OwnerProfile profile =
        profileRepository
            .find(job.ownerId())
            .orElseThrow(() -> new PreconditionFailedException("owner profile is missing"));
    final EmailTemplate template = resolveTemplate(job);
    final Set<String> alreadyContacted =
        job.avoidDuplicates()
            ? deduplicationIndex.buildAlreadyContacted(job.ownerId(), job.includeCollaborators())
            : new HashSet<>();
    return process(
        job, contacts, contact -> generateOne(job, profile, template, alreadyContacted, contact));
  }

  private LoopOutcome runSend(JobRecord job) {
    final List<UUID> emailIds = itemCodec.readEmailIds(loadItems(job));
    return process(job, emailIds, emailId -> sendOne(job, emailId));
  }

  private String loadItems(JobRecord job) {
    return jobRepository
        .findItemsJson(job.jobId())
        .orElseThrow(() -> new IllegalStateException("job items are missing"));
  }

  private EmailTemplate resolveTemplate(JobRecord job) {
    if (job.templateId() != null) {
      return templateRepository
          .findByIdAndOwner(job.templateId(), job.ownerId())
          .orElseThrow(
              () -> new TemplateNotFoundException("template not found: " + job.templateId()));
    }
    return templateRepository
        .findDefault(job.ownerId(), job.stage())
        .orElseThrow(
            () ->
                new TemplateNotFoundException(
                    "no default template for " + job.stage().category()));
  }

  private <T> LoopOutcome process(JobRecord job, List<T> items, ItemHandler<T> handler) {
    if (items.size() != job.totalItems()) {
      throw new IllegalStateException(
          "job items do not match total_items: " + items.size() + " != " + job.totalItems());
    }
    int processed = job.processedItems();
    int success = job.successCount();
    while (processed < items.size()) {
      if (!awaitRunnable(job.jobId())) {
        return new LoopOutcome(processed, success, false);
      }
      if (handler.handle(items.get(processed))) {
        success++;
      }
      processed++;
      jobRepository.updateProgress(job.jobId(), processed, success, Instant.now(clock));
      progressReporter.report(job, processed, success, JobStatus.PROCESSING);
    }
    return new LoopOutcome(processed, success, true);
  }

  /**
   * Returns true when the next item may start. Blocks while the job is paused and returns false
   * once it is no longer processing.
   */
  @VisibleForTesting
  boolean awaitRunnable(UUID jobId) {
    while (true) {
      final long token = signals.token(jobId);
      if (signals.isCancelled(jobId)) {
        return false;
      }
      final JobRecord current = jobRepository.findById(jobId).orElse(null);
      if (current == null || current.status() != JobStatus.PROCESSING) {
        return false;
      }
      if (!current.paused()) {
        return true;
      }
      try {
        signals.await(jobId, token, properties.pausePollInterval());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        logger.warn("job interrupted while paused");
        return false;
      }
    }
  }

  @VisibleForTesting
  boolean generateOne(
      JobRecord job,
      OwnerProfile profile,
      EmailTemplate template,
      Set<String> alreadyContacted,
      Contact contact) {
    if (!contact.hasValidEmail()) {
      metrics.recordGenerationResult("invalid_email");
      logger.info("contact skipped; email missing or malformed");
      return false;
    }
    final String address = contact.normalizedEmail();
    if (job.avoidDuplicates() && alreadyContacted.contains(address)) {
      metrics.recordGenerationResult("duplicate");
      logger.info("contact skipped; already contacted");
      return false;
    }
    final GeneratedContent content;
    try {
      content = contentGenerator.generate(contact, profile, template, job.stage());
    } catch (RuntimeException ex) {
      metrics.recordGenerationResult("generation_error");
      logger.warn("content generation failed; contact skipped", ex);
      return false;
    }
    final Instant now = Instant.now(clock);
    final EmailRecord email =
        new EmailRecord(
            UUID.randomUUID(),
            job.ownerId(),
            address,
            contact.recipientName(),
            contact.company(),
            content.subject(),
            content.body(),
            job.stage(),
            EmailStatus.DRAFT,
            job.groupId(),
            now,
            null,
            null,
            null,
            template.templateId());
    try {
      emailRepository.insert(email);
    } catch (DuplicateKeyException ex) {
      alreadyContacted.add(address);
      metrics.recordGenerationResult("duplicate");
      logger.info("contact skipped; an open email already exists for this stage");
      return false;
    }
    alreadyContacted.add(address);
    metrics.recordGenerationResult("generated");
    return true;
  }

  @VisibleForTesting
  boolean sendOne(JobRecord job, UUID emailId) {
    final EmailRecord email = emailRepository.findByIdAndOwner(emailId, job.ownerId()).orElse(null);
    if (email == null) {
      logger.warn("send skipped; email no longer exists emailId={}", emailId);
      return false;
    }
    if (!email.isSendable()) {
      logger.info("send skipped; email already sent or completed emailId={}", emailId);
      return false;
    }
    try {
      final DispatchResult result = sendDispatcher.dispatch(email);
      if (result.advance().nextStageError() != null) {
        logger.warn(
            "email sent without next stage emailId={} error={}",
            emailId,
            result.advance().nextStageError());
      }
      return true;
    } catch (InvalidEmailStateException | EmailNotFoundException ex) {
      logger.info("send skipped; email changed before dispatch emailId={}", emailId);
      return false;
    } catch (QuotaDeniedException ex) {
      logger.warn("send denied by quota emailId={} reason={}", emailId, ex.getMessage());
      return false;
    } catch (DeliveryException ex) {
      if (ex.isTokenInvalid()) {
        jobRepository.setWarningIfAbsent(job.jobId(), TOKEN_INVALID_WARNING, Instant.now(clock));
      }
      logger.warn("delivery failed emailId={} kind={}", emailId, ex.kind(), ex);
      return false;
    }
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @FunctionalInterface
  private interface ItemHandler<T> {
    boolean handle(T item);
  }

  private record LoopOutcome(int processed, int success, boolean exhausted) {}
}
