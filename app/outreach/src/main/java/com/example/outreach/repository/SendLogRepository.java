package com.example.outreach.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** One row per delivered message; the source for hourly counts and the reputation window. */
@Repository
@RequiredArgsConstructor
public class SendLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public record SendStats(int totalSent, int bounced) {}

  public void insert(String ownerId, String recipientAddress, Instant sentAt, String messageId) {
    final String sql =
        """
        INSERT INTO send_log (send_id, owner_id, recipient_address, sent_at, status, message_id)
        VALUES (:sendId, :ownerId, :recipientAddress, :sentAt, 'sent', :messageId)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sendId", UUID.randomUUID())
            .addValue("ownerId", ownerId)
            .addValue("recipientAddress", recipientAddress)
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("messageId", messageId);
    jdbcTemplate.update(sql, params);
  }

  /** How many of the given addresses already received a message since {@code since}. */
  public int countRecipientsSentSince(
      String ownerId, Collection<String> recipientAddresses, Instant since) {
    if (recipientAddresses.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        SELECT COUNT(DISTINCT recipient_address)
        FROM send_log
        WHERE owner_id = :ownerId
          AND sent_at >= :since
          AND recipient_address IN (:recipientAddresses)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("since", toTimestamp(since))
            .addValue("recipientAddresses", recipientAddresses);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public int countSentSince(String ownerId, Instant since) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM send_log
        WHERE owner_id = :ownerId
          AND sent_at >= :since
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("since", toTimestamp(since));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public SendStats statsSince(String ownerId, Instant since) {
    final String sql =
        """
        SELECT COUNT(*) AS total_sent,
               COUNT(*) FILTER (WHERE status = 'bounced') AS bounced
        FROM send_log
        WHERE owner_id = :ownerId
          AND sent_at >= :since
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("since", toTimestamp(since));
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) -> new SendStats(rs.getInt("total_sent"), rs.getInt("bounced")));
  }

  /** Marks the newest delivered message to the recipient as bounced. */
  public int markLatestBounced(String ownerId, String recipientAddress, String reason) {
    final String sql =
        """
        UPDATE send_log
        SET status = 'bounced',
            bounce_reason = :reason
        WHERE send_id = (
          SELECT send_id
          FROM send_log
          WHERE owner_id = :ownerId
            AND recipient_address = :recipientAddress
            AND status = 'sent'
          ORDER BY sent_at DESC
          LIMIT 1
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("recipientAddress", recipientAddress)
            .addValue("reason", reason);
    return jdbcTemplate.update(sql, params);
  }
}
