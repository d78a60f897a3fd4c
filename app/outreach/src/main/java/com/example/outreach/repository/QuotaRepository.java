/*
 * Where: Outreach data access
 * What: per-day quota counters and the per-owner advisory lock
 * Why: concurrent jobs of one owner share a single quota row
 */
package com.example.outreach.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toSqlDate;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.outreach.model.QuotaRecord;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class QuotaRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockOwner(long lockKey) {
    // Serializes quota writes of one owner across instances until the transaction ends.
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public Optional<QuotaRecord> find(String ownerId, LocalDate day) {
    final String sql =
        """
        SELECT owner_id, send_date, emails_sent, unique_recipients, last_updated
        FROM quota_records
        WHERE owner_id = :ownerId
          AND send_date = :day
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("ownerId", ownerId).addValue("day", toSqlDate(day));
    return jdbcTemplate
        .query(
            sql,
            params,
            (rs, rowNum) ->
                new QuotaRecord(
                    rs.getString("owner_id"),
                    rs.getDate("send_date").toLocalDate(),
                    rs.getInt("emails_sent"),
                    rs.getInt("unique_recipients"),
                    toInstant(rs.getTimestamp("last_updated"))))
        .stream()
        .findFirst();
  }

  /** Adds to the day's counters, creating the row at day rollover. */
  public void increment(
      String ownerId, LocalDate day, int emailsSent, int uniqueRecipients, Instant now) {
    final String sql =
        """
        INSERT INTO quota_records (owner_id, send_date, emails_sent, unique_recipients, last_updated)
        VALUES (:ownerId, :day, :emailsSent, :uniqueRecipients, :now)
        ON CONFLICT (owner_id, send_date) DO UPDATE
          SET emails_sent = quota_records.emails_sent + EXCLUDED.emails_sent,
              unique_recipients = quota_records.unique_recipients + EXCLUDED.unique_recipients,
              last_updated = EXCLUDED.last_updated
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("day", toSqlDate(day))
            .addValue("emailsSent", emailsSent)
            .addValue("uniqueRecipients", uniqueRecipients)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  /** Number of days in [from, to] on which the owner sent at least one email. */
  public int countActiveDays(String ownerId, LocalDate from, LocalDate to) {
    final String sql =
        """
        SELECT COUNT(DISTINCT send_date)
        FROM quota_records
        WHERE owner_id = :ownerId
          AND send_date BETWEEN :from AND :to
          AND emails_sent > 0
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("from", toSqlDate(from))
            .addValue("to", toSqlDate(to));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public List<String> findOwnersActiveSince(LocalDate from) {
    final String sql =
        """
        SELECT DISTINCT owner_id
        FROM quota_records
        WHERE send_date >= :from
        ORDER BY owner_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("from", toSqlDate(from));
    return jdbcTemplate.queryForList(sql, params, String.class);
  }
}
