/*
 * Where: Outreach job engine
 * What: validates, persists and schedules batch jobs and applies pause, resume and cancel
 * Why: callers get a job id immediately and follow progress by polling or subscribing
 */
package com.example.outreach.service;

import com.example.common.TraceIds;
import com.example.outreach.api.InvalidJobStateException;
import com.example.outreach.api.JobNotFoundException;
import com.example.outreach.api.PreconditionFailedException;
import com.example.outreach.config.JobExecutorConfig;
import com.example.outreach.model.Contact;
import com.example.outreach.model.DedupeOptions;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailTemplate;
import com.example.outreach.model.JobKind;
import com.example.outreach.model.JobRecord;
import com.example.outreach.model.OwnerProfile;
import com.example.outreach.repository.EmailRepository;
import com.example.outreach.repository.JobRepository;
import com.example.outreach.repository.OwnerProfileRepository;
import com.example.outreach.repository.TemplateRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

@Service
public class BatchJobService {

  private static final Logger logger = LoggerFactory.getLogger(BatchJobService.class);
  static final String QUEUE_FULL_MESSAGE = "job queue is full; retry later";

  private final JobRepository jobRepository;
  private final EmailRepository emailRepository;
  private final TemplateRepository templateRepository;
  private final OwnerProfileRepository profileRepository;
  private final JobItemCodec itemCodec;
  private final JobRunner jobRunner;
  private final JobSignals signals;
  private final TaskExecutor executor;
  private final Clock clock;

  public BatchJobService(
      JobRepository jobRepository,
      EmailRepository emailRepository,
      TemplateRepository templateRepository,
      OwnerProfileRepository profileRepository,
      JobItemCodec itemCodec,
      JobRunner jobRunner,
      JobSignals signals,
      @Qualifier(JobExecutorConfig.JOB_EXECUTOR) TaskExecutor executor,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.emailRepository = emailRepository;
    this.templateRepository = templateRepository;
    this.profileRepository = profileRepository;
    this.itemCodec = itemCodec;
    this.jobRunner = jobRunner;
    this.signals = signals;
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * Creates a generation job over {@code contacts} and schedules it.
   *
   * @throws PreconditionFailedException when the profile is incomplete, the contact list is empty
   *     or templates for the stage or a later stage are missing
   */
  public JobRecord startGenerationJob(
      String ownerId,
      List<Contact> contacts,
      UUID templateId,
      EmailStage stage,
      DedupeOptions dedupeOptions) {
    if (contacts == null || contacts.isEmpty()) {
      throw new PreconditionFailedException("contacts must not be empty");
    }
    final OwnerProfile profile =
        profileRepository
            .find(ownerId)
            .orElseThrow(() -> new PreconditionFailedException("owner profile is missing"));
    if (!profile.isComplete()) {
      throw new PreconditionFailedException(
          "owner profile is incomplete; full_name, company_name and position are required");
    }
    validateTemplates(ownerId, stage, templateId);
    final DedupeOptions options = dedupeOptions == null ? DedupeOptions.none() : dedupeOptions;
    final JobRecord job =
        JobRecord.start(
            ownerId,
            JobKind.GENERATE,
            UUID.randomUUID(),
            stage,
            templateId,
            options,
            contacts.size(),
            Instant.now(clock));
    jobRepository.insert(job, itemCodec.writeContacts(contacts));
    logger.info(
        "generation job created jobId={} total={} stage={} avoidDuplicates={}",
        job.jobId(),
        job.totalItems(),
        stage.value(),
        options.avoidDuplicates());
    submit(job.jobId());
    return job;
  }

  /**
   * Creates a send job over the unsent emails of {@code stage} in {@code groupId}. When {@code
   * emailIds} is given only those emails are sent, in that order.
   */
  public JobRecord startSendJob(
      String ownerId, EmailStage stage, UUID groupId, List<UUID> emailIds) {
    final List<UUID> sendable = emailRepository.findSendableIds(ownerId, stage, groupId);
    final List<UUID> selected;
    if (emailIds == null || emailIds.isEmpty()) {
      selected = sendable;
    } else {
      final Set<UUID> allowed = new HashSet<>(sendable);
      selected = new ArrayList<>();
      for (UUID emailId : new LinkedHashSet<>(emailIds)) {
        if (allowed.contains(emailId)) {
          selected.add(emailId);
        }
      }
    }
    if (selected.isEmpty()) {
      throw new PreconditionFailedException(
          "no unsent " + stage.value() + " emails to send in this group");
    }
    final JobRecord job =
        JobRecord.start(
            ownerId,
            JobKind.SEND,
            groupId,
            stage,
            null,
            DedupeOptions.none(),
            selected.size(),
            Instant.now(clock));
    jobRepository.insert(job, itemCodec.writeEmailIds(selected));
    logger.info(
        "send job created jobId={} total={} stage={} groupId={}",
        job.jobId(),
        job.totalItems(),
        stage.value(),
        groupId);
    submit(job.jobId());
    return job;
  }

  public JobRecord getJob(String ownerId, UUID jobId) {
    return jobRepository
        .findByIdAndOwner(jobId, ownerId)
        .orElseThrow(() -> new JobNotFoundException(jobId));
  }

  public JobRecord pause(String ownerId, UUID jobId) {
    return setPaused(ownerId, jobId, true);
  }

  public JobRecord resume(String ownerId, UUID jobId) {
    return setPaused(ownerId, jobId, false);
  }

  /** Stops a processing job after its in-flight item; finished items stay recorded. */
  public JobRecord cancel(String ownerId, UUID jobId) {
    final int updated = jobRepository.cancel(jobId, ownerId, Instant.now(clock));
    if (updated == 0) {
      throw stateConflict(ownerId, jobId);
    }
    signals.cancel(jobId);
    logger.info("job cancelled jobId={}", jobId);
    return getJob(ownerId, jobId);
  }

  /** Reschedules every job left processing by a previous run. Returns how many were queued. */
  public int resumeUnfinished() {
    final List<UUID> jobIds = jobRepository.findProcessingIds();
    for (UUID jobId : jobIds) {
      logger.info("resuming unfinished job jobId={}", jobId);
      submit(jobId);
    }
    return jobIds.size();
  }

  @VisibleForTesting
  void validateTemplates(String ownerId, EmailStage stage, UUID templateId) {
    if (templateId != null) {
      final EmailTemplate template =
          templateRepository
              .findByIdAndOwner(templateId, ownerId)
              .orElseThrow(
                  () -> new PreconditionFailedException("template not found: " + templateId));
      if (template.category() != stage) {
        throw new PreconditionFailedException(
            "template category "
                + template.category().category()
                + " does not match stage "
                + stage.value());
      }
    }
    final Set<EmailStage> categories = templateRepository.findCategories(ownerId);
    final List<EmailStage> required = new ArrayList<>();
    EmailStage current = stage;
    while (current != null) {
      required.add(current);
      current = current.next().orElse(null);
    }
    final String missing =
        required.stream()
            .filter(category -> !categories.contains(category))
            .map(EmailStage::category)
            .collect(Collectors.joining(", "));
    if (!missing.isEmpty()) {
      throw new PreconditionFailedException("missing templates for categories: " + missing);
    }
  }

  private JobRecord setPaused(String ownerId, UUID jobId, boolean paused) {
    final int updated = jobRepository.setPaused(jobId, ownerId, paused, Instant.now(clock));
    if (updated == 0) {
      throw stateConflict(ownerId, jobId);
    }
    if (!paused) {
      signals.wake(jobId);
    }
    logger.info("job {} jobId={}", paused ? "paused" : "resumed", jobId);
    return getJob(ownerId, jobId);
  }

  private RuntimeException stateConflict(String ownerId, UUID jobId) {
    final JobRecord job = getJob(ownerId, jobId);
    return new InvalidJobStateException(jobId, job.status());
  }

  private void submit(UUID jobId) {
    final String traceId = TraceIds.currentOrNew();
    try {
      executor.execute(() -> jobRunner.run(jobId, traceId));
    } catch (TaskRejectedException ex) {
      logger.warn("job rejected by executor jobId={}", jobId, ex);
      jobRepository.markError(jobId, QUEUE_FULL_MESSAGE, Instant.now(clock));
    }
  }
}
