package com.example.outreach.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.outreach.config.OutreachJobProperties;
import com.example.outreach.model.Contact;
import com.example.outreach.model.DedupeOptions;
import com.example.outreach.model.EmailRecord;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailStatus;
import com.example.outreach.model.EmailTemplate;
import com.example.outreach.model.GeneratedContent;
import com.example.outreach.model.JobKind;
import com.example.outreach.model.JobRecord;
import com.example.outreach.model.JobStatus;
import com.example.outreach.model.OwnerProfile;
import com.example.outreach.model.ProgressEvent;
import com.example.outreach.model.SendDecision;
import com.example.outreach.repository.EmailRepository;
import com.example.outreach.repository.JobRepository;
import com.example.outreach.repository.OwnerProfileRepository;
import com.example.outreach.repository.TemplateRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;

class JobRunnerTest {

  private static final String OWNER = "owner-1";
  private static final Instant NOW = Instant.parse("2026-01-17T09:00:00Z");

  private JobRepository jobRepository;
  private EmailRepository emailRepository;
  private TemplateRepository templateRepository;
  private OwnerProfileRepository profileRepository;
  private DeduplicationIndex deduplicationIndex;
  private ContentGenerator contentGenerator;
  private SendDispatcher sendDispatcher;
  private ProgressPublisher progressPublisher;
  private JobSignals signals;
  private JobItemCodec itemCodec;
  private SimpleMeterRegistry meterRegistry;
  private JobRunner runner;

  @BeforeEach
  void setUp() {
    jobRepository = mock(JobRepository.class);
    emailRepository = mock(EmailRepository.class);
    templateRepository = mock(TemplateRepository.class);
    profileRepository = mock(OwnerProfileRepository.class);
    deduplicationIndex = mock(DeduplicationIndex.class);
    contentGenerator = mock(ContentGenerator.class);
    sendDispatcher = mock(SendDispatcher.class);
    progressPublisher = mock(ProgressPublisher.class);
    signals = new JobSignals();
    itemCodec = new JobItemCodec(new ObjectMapper());
    meterRegistry = new SimpleMeterRegistry();
    runner = runnerWith(sendDispatcher);
  }

  private JobRunner runnerWith(SendDispatcher dispatcher) {
    return new JobRunner(
        jobRepository,
        emailRepository,
        templateRepository,
        profileRepository,
        deduplicationIndex,
        contentGenerator,
        dispatcher,
        signals,
        new JobProgressReporter(progressPublisher),
        itemCodec,
        new OutreachMetrics(meterRegistry),
        new OutreachJobProperties(2, 10, Duration.ofMillis(10), 40, false),
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void generationSkipsInvalidAndAlreadyContactedRecipients() {
    final List<Contact> contacts = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      contacts.add(contact("not-an-email-" + i));
    }
    final Set<String> alreadyContacted = new HashSet<>();
    for (int i = 0; i < 5; i++) {
      contacts.add(contact("Dup" + i + "@Acme.test"));
      alreadyContacted.add("dup" + i + "@acme.test");
    }
    for (int i = 0; i < 85; i++) {
      contacts.add(contact("user" + i + "@acme.test"));
    }
    final JobRecord job = generationJob(contacts.size(), true);
    givenJob(job, itemCodec.writeContacts(contacts));
    givenGenerationDependencies();
    when(deduplicationIndex.buildAlreadyContacted(OWNER, false)).thenReturn(alreadyContacted);

    runner.run(job.jobId(), "trace-1");

    verify(emailRepository, times(85)).insert(any());
    verify(jobRepository).updateProgress(job.jobId(), 100, 85, NOW);
    verify(jobRepository).markCompleted(job.jobId(), NOW);
    assertThat(
            meterRegistry
                .get("outreach.generation.total")
                .tag("result", "invalid_email")
                .counter()
                .count())
        .isEqualTo(10.0d);
    assertThat(
            meterRegistry
                .get("outreach.generation.total")
                .tag("result", "duplicate")
                .counter()
                .count())
        .isEqualTo(5.0d);

    final ArgumentCaptor<ProgressEvent> events = ArgumentCaptor.forClass(ProgressEvent.class);
    verify(progressPublisher, times(101)).publish(eq(OWNER), events.capture());
    final ProgressEvent last = events.getValue();
    assertThat(last.status()).isEqualTo("completed");
    assertThat(last.current()).isEqualTo(100);
    assertThat(last.successCount()).isEqualTo(85);
    assertThat(last.failureCount()).isEqualTo(15);
  }

  @Test
  void generationFiltersRepeatsWithinTheSameBatch() {
    final List<Contact> contacts =
        List.of(contact("jane@acme.test"), contact(" JANE@acme.test "), contact("bob@acme.test"));
    final JobRecord job = generationJob(contacts.size(), true);
    givenJob(job, itemCodec.writeContacts(contacts));
    givenGenerationDependencies();
    when(deduplicationIndex.buildAlreadyContacted(OWNER, false)).thenReturn(new HashSet<>());

    runner.run(job.jobId(), "trace-1");

    verify(emailRepository, times(2)).insert(any());
    verify(jobRepository).updateProgress(job.jobId(), 3, 2, NOW);
  }

  @Test
  void generatedEmailsAreDraftsInTheJobGroup() {
    final JobRecord job = generationJob(1, false);
    final EmailTemplate template = givenGenerationDependencies();

    final boolean generated =
        runner.generateOne(
            job, profile(), template, new HashSet<>(), contact("Jane@Acme.test"));

    final ArgumentCaptor<EmailRecord> captor = ArgumentCaptor.forClass(EmailRecord.class);
    verify(emailRepository).insert(captor.capture());
    final EmailRecord email = captor.getValue();
    assertThat(generated).isTrue();
    assertThat(email.recipientAddress()).isEqualTo("jane@acme.test");
    assertThat(email.status()).isEqualTo(EmailStatus.DRAFT);
    assertThat(email.stage()).isEqualTo(EmailStage.OUTREACH);
    assertThat(email.groupId()).isEqualTo(job.groupId());
    assertThat(email.templateId()).isEqualTo(template.templateId());
    assertThat(email.sentAt()).isNull();
  }

  @Test
  void generationFailureAndUniqueConflictCountAsFailures() {
    final JobRecord job = generationJob(2, false);
    final EmailTemplate template = givenGenerationDependencies();
    when(contentGenerator.generate(any(), any(), any(), any()))
        .thenThrow(new ContentGenerationException("template placeholder missing"))
        .thenReturn(new GeneratedContent("Hello", "Body"));
    doThrow(new DuplicateKeyException("uq_emails_open_stage"))
        .when(emailRepository)
        .insert(any());

    assertThat(runner.generateOne(job, profile(), template, new HashSet<>(), contact("a@b.test")))
        .isFalse();
    assertThat(runner.generateOne(job, profile(), template, new HashSet<>(), contact("c@d.test")))
        .isFalse();
    assertThat(
            meterRegistry
                .get("outreach.generation.total")
                .tag("result", "generation_error")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void sendJobRecordsTokenWarningAndKeepsGoing() {
    final EmailRecord first = draft();
    final EmailRecord second = draft();
    final EmailRecord third = draft();
    final JobRecord job = sendJob(3, 0, 0);
    givenJob(
        job, itemCodec.writeEmailIds(List.of(first.emailId(), second.emailId(), third.emailId())));
    for (EmailRecord email : List.of(first, second, third)) {
      when(emailRepository.findByIdAndOwner(email.emailId(), OWNER)).thenReturn(Optional.of(email));
    }
    when(sendDispatcher.dispatch(first))
        .thenReturn(
            new DispatchResult(
                "msg-1", null, new AdvanceResult(first, null, false, false, "no template")));
    when(sendDispatcher.dispatch(second))
        .thenThrow(new DeliveryException(DeliveryException.Kind.TOKEN_INVALID, "token expired"));
    when(sendDispatcher.dispatch(third))
        .thenThrow(new QuotaDeniedException("Daily limit reached (50/50). 0 remaining."));

    runner.run(job.jobId(), "trace-2");

    verify(jobRepository).setWarningIfAbsent(job.jobId(), JobRunner.TOKEN_INVALID_WARNING, NOW);
    verify(jobRepository).updateProgress(job.jobId(), 3, 1, NOW);
    verify(jobRepository).markCompleted(job.jobId(), NOW);
  }

  @Test
  void sendJobResumesFromItsCheckpoint() {
    final EmailRecord first = draft();
    final EmailRecord second = draft();
    final EmailRecord third = draft();
    final JobRecord job = sendJob(3, 2, 1);
    givenJob(
        job, itemCodec.writeEmailIds(List.of(first.emailId(), second.emailId(), third.emailId())));
    when(emailRepository.findByIdAndOwner(third.emailId(), OWNER)).thenReturn(Optional.of(third));
    when(sendDispatcher.dispatch(third))
        .thenReturn(
            new DispatchResult(
                "msg-3", null, new AdvanceResult(third, null, false, false, null)));

    runner.run(job.jobId(), "trace-3");

    verify(sendDispatcher, times(1)).dispatch(any());
    verify(emailRepository, never()).findByIdAndOwner(first.emailId(), OWNER);
    verify(jobRepository).updateProgress(job.jobId(), 3, 2, NOW);
  }

  @Test
  void sendJobStopsDeliveringOnceTheDailyQuotaIsSpent() {
    final List<String> delivered = new CopyOnWriteArrayList<>();
    final JobRunner quotaRunner =
        runnerWith(
            realDispatcher(
                (ownerId, to, subject, body) -> {
                  delivered.add(to);
                  return "msg-" + delivered.size();
                },
                48,
                50));
    final List<EmailRecord> drafts = storedDrafts(5);
    final JobRecord job = sendJob(5, 0, 0);
    givenJob(job, emailIds(drafts));

    quotaRunner.run(job.jobId(), "trace-7");

    assertThat(delivered)
        .containsExactly(drafts.get(0).recipientAddress(), drafts.get(1).recipientAddress());
    verify(jobRepository).updateProgress(job.jobId(), 5, 2, NOW);
    verify(jobRepository).markCompleted(job.jobId(), NOW);
    assertThat(meterRegistry.get("outreach.quota.denied.total").counter().count())
        .isEqualTo(3.0d);
    final ArgumentCaptor<ProgressEvent> events = ArgumentCaptor.forClass(ProgressEvent.class);
    verify(progressPublisher, times(6)).publish(eq(OWNER), events.capture());
    assertThat(events.getValue().status()).isEqualTo("completed");
    assertThat(events.getValue().successCount()).isEqualTo(2);
  }

  @Test
  void pausedSendJobDispatchesNothingAndResumesAtTheNextItem() throws Exception {
    final List<EmailRecord> drafts = storedDrafts(4);
    final JobRecord job = sendJob(4, 0, 0);
    givenJob(job, emailIds(drafts));
    final AtomicReference<JobRecord> state = new AtomicReference<>(job);
    final CountDownLatch pausedPolls = new CountDownLatch(3);
    when(jobRepository.findById(job.jobId()))
        .thenAnswer(
            call -> {
              final JobRecord current = state.get();
              if (current.paused()) {
                pausedPolls.countDown();
              }
              return Optional.of(current);
            });
    final List<String> delivered = new CopyOnWriteArrayList<>();
    final AtomicInteger deliveredWhilePaused = new AtomicInteger(-1);
    final AtomicReference<Throwable> resumeFailure = new AtomicReference<>();
    final Thread resumer =
        new Thread(
            () -> {
              try {
                if (!pausedPolls.await(5, TimeUnit.SECONDS)) {
                  resumeFailure.set(new AssertionError("runner never observed the pause"));
                }
              } catch (InterruptedException ex) {
                resumeFailure.set(ex);
              }
              deliveredWhilePaused.set(delivered.size());
              state.set(withStatus(job, JobStatus.PROCESSING, false));
              signals.wake(job.jobId());
            });
    final JobRunner pausingRunner =
        runnerWith(
            realDispatcher(
                (ownerId, to, subject, body) -> {
                  delivered.add(to);
                  if (delivered.size() == 1) {
                    // Paused while the first item is in flight.
                    state.set(withStatus(job, JobStatus.PROCESSING, true));
                    resumer.start();
                  }
                  return "msg-" + delivered.size();
                },
                0,
                50));

    pausingRunner.run(job.jobId(), "trace-8");
    resumer.join(5000);

    assertThat(resumeFailure.get()).isNull();
    assertThat(deliveredWhilePaused.get()).isEqualTo(1);
    assertThat(delivered)
        .containsExactly(
            drafts.get(0).recipientAddress(),
            drafts.get(1).recipientAddress(),
            drafts.get(2).recipientAddress(),
            drafts.get(3).recipientAddress());
    verify(jobRepository).updateProgress(job.jobId(), 1, 1, NOW);
    verify(jobRepository).updateProgress(job.jobId(), 4, 4, NOW);
    verify(jobRepository).markCompleted(job.jobId(), NOW);
  }

  @Test
  void alreadySentEmailIsSkippedWithoutDispatch() {
    final JobRecord job = sendJob(1, 0, 0);
    final EmailRecord sent =
        withSentAt(draft(), NOW.minus(Duration.ofHours(1)), EmailStatus.FOLLOWUP_DUE);
    when(emailRepository.findByIdAndOwner(sent.emailId(), OWNER)).thenReturn(Optional.of(sent));

    assertThat(runner.sendOne(job, sent.emailId())).isFalse();
    assertThat(runner.sendOne(job, UUID.randomUUID())).isFalse();
    verify(sendDispatcher, never()).dispatch(any());
  }

  @Test
  void cancelledJobStopsAndReportsItsState() {
    final List<Contact> contacts = List.of(contact("a@b.test"), contact("c@d.test"));
    final JobRecord job = generationJob(contacts.size(), false);
    final JobRecord cancelled = withStatus(job, JobStatus.CANCELLED, false);
    when(jobRepository.findById(job.jobId()))
        .thenReturn(Optional.of(job))
        .thenReturn(Optional.of(cancelled));
    when(jobRepository.findItemsJson(job.jobId()))
        .thenReturn(Optional.of(itemCodec.writeContacts(contacts)));
    givenGenerationDependencies();

    runner.run(job.jobId(), "trace-4");

    verify(emailRepository, never()).insert(any());
    verify(jobRepository, never()).markCompleted(any(), any());
    assertThat(
            meterRegistry
                .get("outreach.jobs.finished.total")
                .tags("kind", "generate", "status", "cancelled")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void awaitRunnableWaitsWhilePausedAndStopsOnCancelSignal() {
    final JobRecord job = generationJob(1, false);
    when(jobRepository.findById(job.jobId()))
        .thenReturn(Optional.of(withStatus(job, JobStatus.PROCESSING, true)))
        .thenReturn(Optional.of(withStatus(job, JobStatus.PROCESSING, true)))
        .thenReturn(Optional.of(job));
    signals.register(job.jobId());

    assertThat(runner.awaitRunnable(job.jobId())).isTrue();

    signals.cancel(job.jobId());
    assertThat(runner.awaitRunnable(job.jobId())).isFalse();
    signals.unregister(job.jobId());
  }

  @Test
  void failedJobIsMarkedWithTruncatedError() {
    final List<Contact> contacts = List.of(contact("a@b.test"));
    final JobRecord job = generationJob(2, false);
    givenJob(job, itemCodec.writeContacts(contacts));
    givenGenerationDependencies();

    runner.run(job.jobId(), "trace-5");

    verify(jobRepository).markError(eq(job.jobId()), contains("job items do not match"), eq(NOW));
    final ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
    verify(jobRepository).markError(eq(job.jobId()), message.capture(), eq(NOW));
    assertThat(message.getValue()).hasSize(40);
    verify(jobRepository, never()).updateProgress(any(), anyInt(), anyInt(), any());
  }

  @Test
  void missingProfileFailsTheJob() {
    final JobRecord job = generationJob(1, false);
    givenJob(job, itemCodec.writeContacts(List.of(contact("a@b.test"))));
    when(profileRepository.find(OWNER)).thenReturn(Optional.empty());
    when(jobRepository.markError(any(), anyString(), any())).thenReturn(1);

    runner.run(job.jobId(), "trace-6");

    verify(jobRepository).markError(job.jobId(), "owner profile is missing", NOW);
    final ArgumentCaptor<ProgressEvent> events = ArgumentCaptor.forClass(ProgressEvent.class);
    verify(progressPublisher).publish(eq(OWNER), events.capture());
    assertThat(events.getValue().status()).isEqualTo("error");
  }

  /** Dispatcher over a mocked governor whose daily count starts at {@code sentToday}. */
  private SendDispatcher realDispatcher(MailDelivery delivery, int sentToday, int dailyLimit) {
    final SendingRateGovernor governor = mock(SendingRateGovernor.class);
    final AtomicInteger sent = new AtomicInteger(sentToday);
    when(governor.canSend(OWNER, 1))
        .thenAnswer(
            call ->
                sent.get() < dailyLimit
                    ? SendDecision.allow("Within limits", null)
                    : SendDecision.deny(
                        "Daily limit reached (" + sent.get() + "/" + dailyLimit + ")."));
    doAnswer(
            call -> {
              sent.incrementAndGet();
              return null;
            })
        .when(governor)
        .recordSend(eq(OWNER), anyCollection(), anyString());
    final StageLifecycleService lifecycleService = mock(StageLifecycleService.class);
    when(lifecycleService.advance(any()))
        .thenAnswer(call -> new AdvanceResult(call.getArgument(0), null, false, false, null));
    return new SendDispatcher(
        governor, delivery, lifecycleService, emailRepository, new OutreachMetrics(meterRegistry));
  }

  private List<EmailRecord> storedDrafts(int count) {
    final List<EmailRecord> drafts = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      final EmailRecord email = draft();
      when(emailRepository.findByIdAndOwner(email.emailId(), OWNER)).thenReturn(Optional.of(email));
      when(emailRepository.findById(email.emailId())).thenReturn(Optional.of(email));
      drafts.add(email);
    }
    return drafts;
  }

  private String emailIds(List<EmailRecord> emails) {
    return itemCodec.writeEmailIds(emails.stream().map(EmailRecord::emailId).toList());
  }

  private void givenJob(JobRecord job, String itemsJson) {
    when(jobRepository.findById(job.jobId())).thenReturn(Optional.of(job));
    when(jobRepository.findItemsJson(job.jobId())).thenReturn(Optional.of(itemsJson));
    when(jobRepository.markCompleted(job.jobId(), NOW)).thenReturn(1);
  }

  private EmailTemplate givenGenerationDependencies() {
    final EmailTemplate template =
        new EmailTemplate(
            UUID.randomUUID(), OWNER, "intro", EmailStage.OUTREACH, "Hi", "Body", true, NOW, NOW);
    when(profileRepository.find(OWNER)).thenReturn(Optional.of(profile()));
    when(templateRepository.findDefault(OWNER, EmailStage.OUTREACH))
        .thenReturn(Optional.of(template));
    when(contentGenerator.generate(any(), any(), any(), any()))
        .thenReturn(new GeneratedContent("Hello", "Body"));
    return template;
  }

  private static JobRecord generationJob(int total, boolean avoidDuplicates) {
    return JobRecord.start(
        OWNER,
        JobKind.GENERATE,
        UUID.randomUUID(),
        EmailStage.OUTREACH,
        null,
        new DedupeOptions(avoidDuplicates, false),
        total,
        NOW);
  }

  private static JobRecord sendJob(int total, int processed, int success) {
    final JobRecord started =
        JobRecord.start(
            OWNER,
            JobKind.SEND,
            UUID.randomUUID(),
            EmailStage.OUTREACH,
            null,
            new DedupeOptions(false, false),
            total,
            NOW);
    return new JobRecord(
        started.jobId(),
        OWNER,
        JobKind.SEND,
        started.groupId(),
        EmailStage.OUTREACH,
        null,
        false,
        false,
        total,
        processed,
        success,
        JobStatus.PROCESSING,
        false,
        null,
        null,
        NOW,
        NOW);
  }

  private static JobRecord withStatus(JobRecord job, JobStatus status, boolean paused) {
    return new JobRecord(
        job.jobId(),
        job.ownerId(),
        job.kind(),
        job.groupId(),
        job.stage(),
        job.templateId(),
        job.avoidDuplicates(),
        job.includeCollaborators(),
        job.totalItems(),
        job.processedItems(),
        job.successCount(),
        status,
        paused,
        null,
        null,
        job.createdAt(),
        job.updatedAt());
  }

  private static Contact contact(String email) {
    return new Contact(email, "Jane", "Doe", "Acme", "CTO", null, null);
  }

  private static OwnerProfile profile() {
    return new OwnerProfile(OWNER, "Sam Sender", "Founder", "Sender Co", null, null, 3, 6, false);
  }

  private static EmailRecord draft() {
    return new EmailRecord(
        UUID.randomUUID(),
        OWNER,
        UUID.randomUUID() + "@acme.test",
        "Jane Doe",
        "Acme",
        "Hello",
        "Body",
        EmailStage.OUTREACH,
        EmailStatus.DRAFT,
        UUID.randomUUID(),
        NOW,
        null,
        null,
        null,
        null);
  }

  private static EmailRecord withSentAt(EmailRecord email, Instant sentAt, EmailStatus status) {
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
        null,
        null,
        null);
  }
}
