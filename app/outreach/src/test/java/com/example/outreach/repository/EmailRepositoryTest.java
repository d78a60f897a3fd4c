/*
 * Where: Outreach repository tests
 * What: runs the email SQL against the real migration
 * Why: send idempotence and the one-active-per-stage rule live in the database
 */
package com.example.outreach.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.outreach.AbstractPostgresContainerTest;
import com.example.outreach.model.EmailRecord;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class EmailRepositoryTest extends AbstractPostgresContainerTest {

  private static final String OWNER = "owner-1";
  private static final Instant BASE = Instant.parse("2026-03-02T09:00:00Z");

  @Autowired private EmailRepository emailRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM emails", new MapSqlParameterSource());
  }

  @Test
  void secondActiveEmailForSameStageIsRejected() {
    emailRepository.insert(draft("ann@example.com", EmailStage.OUTREACH, null, BASE));

    assertThatThrownBy(
            () ->
                emailRepository.insert(
                    draft("ann@example.com", EmailStage.OUTREACH, null, BASE.plusSeconds(1))))
        .isInstanceOf(DuplicateKeyException.class);
  }

  @Test
  void completedEmailDoesNotBlockANewOneForTheSameStage() {
    final EmailRecord first = draft("ann@example.com", EmailStage.OUTREACH, null, BASE);
    emailRepository.insert(first);
    emailRepository.completeAll(OWNER, "ann@example.com");

    emailRepository.insert(
        draft("ann@example.com", EmailStage.OUTREACH, null, BASE.plusSeconds(1)));

    assertThat(emailRepository.findByRecipient(OWNER, "ann@example.com"))
        .extracting(EmailRecord::status)
        .containsExactly(EmailStatus.COMPLETED, EmailStatus.DRAFT);
  }

  @Test
  void markSentOnlyAppliesOnce() {
    final EmailRecord email = draft("ann@example.com", EmailStage.OUTREACH, null, BASE);
    emailRepository.insert(email);
    final Instant sentAt = BASE.plus(Duration.ofHours(1));
    final Instant followupDue = sentAt.plus(Duration.ofDays(3));

    final int first =
        emailRepository.markSent(
            email.emailId(), sentAt, EmailStatus.FOLLOWUP_DUE, followupDue, null);
    final int second =
        emailRepository.markSent(
            email.emailId(), sentAt.plusSeconds(60), EmailStatus.FOLLOWUP_DUE, null, null);

    assertThat(first).isEqualTo(1);
    assertThat(second).isZero();
    final EmailRecord stored = emailRepository.findById(email.emailId()).orElseThrow();
    assertThat(stored.sentAt()).isEqualTo(sentAt);
    assertThat(stored.status()).isEqualTo(EmailStatus.FOLLOWUP_DUE);
    assertThat(stored.followupDueAt()).isEqualTo(followupDue);
    assertThat(stored.lastchanceDueAt()).isNull();
  }

  @Test
  void sendableIdsSkipSentEmailsAndFollowCreationOrder() {
    final UUID groupId = UUID.randomUUID();
    final EmailRecord later =
        draft("bob@example.com", EmailStage.OUTREACH, groupId, BASE.plusSeconds(5));
    final EmailRecord earlier = draft("ann@example.com", EmailStage.OUTREACH, groupId, BASE);
    final EmailRecord sent =
        draft("cid@example.com", EmailStage.OUTREACH, groupId, BASE.plusSeconds(1));
    final EmailRecord otherGroup =
        draft("dan@example.com", EmailStage.OUTREACH, UUID.randomUUID(), BASE);
    emailRepository.insert(later);
    emailRepository.insert(earlier);
    emailRepository.insert(sent);
    emailRepository.insert(otherGroup);
    emailRepository.markSent(sent.emailId(), BASE, EmailStatus.FOLLOWUP_DUE, null, null);

    final List<UUID> ids = emailRepository.findSendableIds(OWNER, EmailStage.OUTREACH, groupId);

    assertThat(ids).containsExactly(earlier.emailId(), later.emailId());
  }

  @Test
  void completeSentLeavesUnsentDraftsOpen() {
    final EmailRecord outreach = draft("ann@example.com", EmailStage.OUTREACH, null, BASE);
    final EmailRecord followup =
        draft("ann@example.com", EmailStage.FOLLOWUP, null, BASE.plusSeconds(1));
    emailRepository.insert(outreach);
    emailRepository.insert(followup);
    emailRepository.markSent(outreach.emailId(), BASE, EmailStatus.FOLLOWUP_DUE, null, null);

    final int completed = emailRepository.completeSent(OWNER, "ann@example.com");

    assertThat(completed).isEqualTo(1);
    assertThat(emailRepository.existsActive(OWNER, "ann@example.com", EmailStage.OUTREACH))
        .isFalse();
    assertThat(emailRepository.existsActive(OWNER, "ann@example.com", EmailStage.FOLLOWUP))
        .isTrue();
  }

  @Test
  void deleteByRecipientRemovesEveryStage() {
    emailRepository.insert(draft("ann@example.com", EmailStage.OUTREACH, null, BASE));
    emailRepository.insert(draft("ann@example.com", EmailStage.FOLLOWUP, null, BASE));
    emailRepository.insert(draft("bob@example.com", EmailStage.OUTREACH, null, BASE));

    final int deleted = emailRepository.deleteByRecipient(OWNER, "ann@example.com");

    assertThat(deleted).isEqualTo(2);
    assertThat(emailRepository.findRecipientAddresses(OWNER)).containsExactly("bob@example.com");
  }

  @Test
  void deleteUnsentKeepsSentEmails() {
    final EmailRecord email = draft("ann@example.com", EmailStage.OUTREACH, null, BASE);
    emailRepository.insert(email);
    emailRepository.markSent(email.emailId(), BASE, EmailStatus.FOLLOWUP_DUE, null, null);

    assertThat(emailRepository.deleteUnsent(email.emailId(), OWNER)).isZero();
    assertThat(emailRepository.findById(email.emailId())).isPresent();
  }

  @Test
  void findByIdAndOwnerHidesOtherOwnersEmails() {
    final EmailRecord email = draft("ann@example.com", EmailStage.OUTREACH, null, BASE);
    emailRepository.insert(email);

    assertThat(emailRepository.findByIdAndOwner(email.emailId(), "owner-2")).isEmpty();
    assertThat(emailRepository.findByIdAndOwner(email.emailId(), OWNER)).isPresent();
  }

  private static EmailRecord draft(
      String recipient, EmailStage stage, UUID groupId, Instant createdAt) {
    return new EmailRecord(
        UUID.randomUUID(),
        OWNER,
        recipient,
        "Recipient",
        "Acme",
        "Hello",
        "Body",
        stage,
        EmailStatus.DRAFT,
        groupId,
        createdAt,
        null,
        null,
        null,
        null);
  }
}
