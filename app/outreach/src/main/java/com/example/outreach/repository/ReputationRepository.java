package com.example.outreach.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.outreach.model.ReputationRecord;
import com.example.outreach.model.WarmupStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ReputationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<ReputationRecord> find(String ownerId) {
    final String sql =
        """
        SELECT owner_id, score, total_sent, total_bounced, total_spam_reports,
               successful_deliveries, warmup_status, last_calculated
        FROM reputation_records
        WHERE owner_id = :ownerId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public void upsert(ReputationRecord record) {
    final String sql =
        """
        INSERT INTO reputation_records (
          owner_id, score, total_sent, total_bounced, total_spam_reports,
          successful_deliveries, warmup_status, last_calculated
        ) VALUES (
          :ownerId, :score, :totalSent, :totalBounced, :totalSpamReports,
          :successfulDeliveries, :warmupStatus, :lastCalculated
        )
        ON CONFLICT (owner_id) DO UPDATE
          SET score = EXCLUDED.score,
              total_sent = EXCLUDED.total_sent,
              total_bounced = EXCLUDED.total_bounced,
              total_spam_reports = EXCLUDED.total_spam_reports,
              successful_deliveries = EXCLUDED.successful_deliveries,
              warmup_status = EXCLUDED.warmup_status,
              last_calculated = EXCLUDED.last_calculated
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", record.ownerId())
            .addValue("score", record.score())
            .addValue("totalSent", record.totalSent())
            .addValue("totalBounced", record.totalBounced())
            .addValue("totalSpamReports", record.totalSpamReports())
            .addValue("successfulDeliveries", record.successfulDeliveries())
            .addValue("warmupStatus", record.warmupStatus().value())
            .addValue("lastCalculated", toTimestamp(record.lastCalculated()));
    jdbcTemplate.update(sql, params);
  }

  public void upsertWarmupStatus(String ownerId, WarmupStatus status, double initialScore) {
    final String sql =
        """
        INSERT INTO reputation_records (owner_id, score, warmup_status, last_calculated)
        VALUES (:ownerId, :score, :warmupStatus, NULL)
        ON CONFLICT (owner_id) DO UPDATE
          SET warmup_status = EXCLUDED.warmup_status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("score", initialScore)
            .addValue("warmupStatus", status.value());
    jdbcTemplate.update(sql, params);
  }

  private ReputationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ReputationRecord(
        rs.getString("owner_id"),
        rs.getDouble("score"),
        rs.getInt("total_sent"),
        rs.getInt("total_bounced"),
        rs.getInt("total_spam_reports"),
        rs.getInt("successful_deliveries"),
        WarmupStatus.fromValue(rs.getString("warmup_status")),
        toInstant(rs.getTimestamp("last_calculated")));
  }
}
