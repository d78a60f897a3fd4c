/*
 * Where: Outreach data access
 * What: reads and transitions rows of the emails table
 * Why: the lifecycle engine and job engine share one set of guarded updates
 */
package com.example.outreach.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.outreach.model.EmailRecord;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EmailRepository {

  private static final String COLUMNS =
      """
      email_id, owner_id, recipient_address, recipient_name, recipient_company, subject, body,
      stage, status, group_id, template_id, created_at, sent_at, followup_due_at, lastchance_due_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts a new email. Fails with {@link org.springframework.dao.DuplicateKeyException} when an
   * active email already exists for the same owner, recipient and stage.
   */
  public void insert(EmailRecord record) {
    final String sql =
        """
        INSERT INTO emails (
          email_id, owner_id, recipient_address, recipient_name, recipient_company, subject, body,
          stage, status, group_id, template_id, created_at, sent_at, followup_due_at, lastchance_due_at
        ) VALUES (
          :emailId, :ownerId, :recipientAddress, :recipientName, :recipientCompany, :subject, :body,
          :stage, :status, :groupId, :templateId, :createdAt, :sentAt, :followupDueAt, :lastchanceDueAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("emailId", record.emailId())
            .addValue("ownerId", record.ownerId())
            .addValue("recipientAddress", record.recipientAddress())
            .addValue("recipientName", record.recipientName())
            .addValue("recipientCompany", record.recipientCompany())
            .addValue("subject", record.subject())
            .addValue("body", record.body())
            .addValue("stage", record.stage().value())
            .addValue("status", record.status().value())
            .addValue("groupId", record.groupId())
            .addValue("templateId", record.templateId())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()))
            .addValue("followupDueAt", toTimestamp(record.followupDueAt()))
            .addValue("lastchanceDueAt", toTimestamp(record.lastchanceDueAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<EmailRecord> findById(UUID emailId) {
    final String sql = "SELECT " + COLUMNS + " FROM emails WHERE email_id = :emailId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("emailId", emailId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<EmailRecord> findByIdAndOwner(UUID emailId, String ownerId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM emails WHERE email_id = :emailId AND owner_id = :ownerId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("emailId", emailId).addValue("ownerId", ownerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<EmailRecord> findByOwner(String ownerId, EmailStage stage, UUID groupId) {
    final StringBuilder sql =
        new StringBuilder("SELECT ").append(COLUMNS).append(" FROM emails WHERE owner_id = :ownerId");
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    if (stage != null) {
      sql.append(" AND stage = :stage");
      params.addValue("stage", stage.value());
    }
    if (groupId != null) {
      sql.append(" AND group_id = :groupId");
      params.addValue("groupId", groupId);
    }
    sql.append(" ORDER BY created_at DESC, email_id");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  /** Unsent emails of one stage and group, in the order a send job processes them. */
  public List<UUID> findSendableIds(String ownerId, EmailStage stage, UUID groupId) {
    final String sql =
        """
        SELECT email_id
        FROM emails
        WHERE owner_id = :ownerId
          AND stage = :stage
          AND group_id = :groupId
          AND sent_at IS NULL
          AND status <> 'completed'
        ORDER BY created_at, email_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("stage", stage.value())
            .addValue("groupId", groupId);
    return jdbcTemplate.query(
        sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("email_id")));
  }

  public List<EmailRecord> findByRecipient(String ownerId, String recipientAddress) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM emails
            WHERE owner_id = :ownerId
              AND recipient_address = :recipientAddress
            ORDER BY created_at
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("recipientAddress", recipientAddress);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public boolean existsActive(String ownerId, String recipientAddress, EmailStage stage) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM emails
          WHERE owner_id = :ownerId
            AND recipient_address = :recipientAddress
            AND stage = :stage
            AND status <> 'completed'
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("recipientAddress", recipientAddress)
            .addValue("stage", stage.value());
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  /** Every address ever emailed by the owner, regardless of stage or status. */
  public List<String> findRecipientAddresses(String ownerId) {
    final String sql =
        "SELECT DISTINCT recipient_address FROM emails WHERE owner_id = :ownerId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  /**
   * Records the send of an unsent email. Returns 0 when the email was already sent or no longer
   * exists, which callers treat as an idempotent no-op.
   */
  public int markSent(
      UUID emailId,
      Instant sentAt,
      EmailStatus status,
      Instant followupDueAt,
      Instant lastchanceDueAt) {
    final String sql =
        """
        UPDATE emails
        SET sent_at = :sentAt,
            status = :status,
            followup_due_at = COALESCE(:followupDueAt, followup_due_at),
            lastchance_due_at = COALESCE(:lastchanceDueAt, lastchance_due_at)
        WHERE email_id = :emailId
          AND sent_at IS NULL
          AND status <> 'completed'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("emailId", emailId)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("status", status.value())
            .addValue("followupDueAt", toTimestamp(followupDueAt))
            .addValue("lastchanceDueAt", toTimestamp(lastchanceDueAt));
    return jdbcTemplate.update(sql, params);
  }

  public int updateUnsentStatus(UUID emailId, String ownerId, EmailStatus status) {
    final String sql =
        """
        UPDATE emails
        SET status = :status
        WHERE email_id = :emailId
          AND owner_id = :ownerId
          AND sent_at IS NULL
          AND status <> 'completed'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("emailId", emailId)
            .addValue("ownerId", ownerId)
            .addValue("status", status.value());
    return jdbcTemplate.update(sql, params);
  }

  public int deleteUnsent(UUID emailId, String ownerId) {
    final String sql =
        """
        DELETE FROM emails
        WHERE email_id = :emailId
          AND owner_id = :ownerId
          AND sent_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("emailId", emailId).addValue("ownerId", ownerId);
    return jdbcTemplate.update(sql, params);
  }

  /** Closes the sent emails of a recipient whose last stage has gone out. */
  public int completeSent(String ownerId, String recipientAddress) {
    final String sql =
        """
        UPDATE emails
        SET status = 'completed'
        WHERE owner_id = :ownerId
          AND recipient_address = :recipientAddress
          AND sent_at IS NOT NULL
          AND status <> 'completed'
        """;
    return jdbcTemplate.update(sql, recipientParams(ownerId, recipientAddress));
  }

  /** Closes every email of a recipient, sent or not. Used when the recipient has replied. */
  public int completeAll(String ownerId, String recipientAddress) {
    final String sql =
        """
        UPDATE emails
        SET status = 'completed'
        WHERE owner_id = :ownerId
          AND recipient_address = :recipientAddress
          AND status <> 'completed'
        """;
    return jdbcTemplate.update(sql, recipientParams(ownerId, recipientAddress));
  }

  public int deleteByRecipient(String ownerId, String recipientAddress) {
    final String sql =
        """
        DELETE FROM emails
        WHERE owner_id = :ownerId
          AND recipient_address = :recipientAddress
        """;
    return jdbcTemplate.update(sql, recipientParams(ownerId, recipientAddress));
  }

  /** Sent emails still waiting on a later stage, oldest send first. */
  public List<EmailRecord> findAwaitingReply(int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM emails
            WHERE sent_at IS NOT NULL
              AND status IN ('followup_due', 'lastchance_due')
            ORDER BY sent_at
            LIMIT :limit
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MapSqlParameterSource recipientParams(String ownerId, String recipientAddress) {
    return new MapSqlParameterSource()
        .addValue("ownerId", ownerId)
        .addValue("recipientAddress", recipientAddress);
  }

  private EmailRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String groupId = rs.getString("group_id");
    final String templateId = rs.getString("template_id");
    return new EmailRecord(
        UUID.fromString(rs.getString("email_id")),
        rs.getString("owner_id"),
        rs.getString("recipient_address"),
        rs.getString("recipient_name"),
        rs.getString("recipient_company"),
        rs.getString("subject"),
        rs.getString("body"),
        EmailStage.fromValue(rs.getString("stage")),
        EmailStatus.fromValue(rs.getString("status")),
        groupId == null ? null : UUID.fromString(groupId),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("followup_due_at")),
        toInstant(rs.getTimestamp("lastchance_due_at")),
        templateId == null ? null : UUID.fromString(templateId));
  }
}
