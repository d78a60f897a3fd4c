package com.example.outreach.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.outreach.model.CompletionRecord;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CompletionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Returns 1 when the record was written, 0 when one already existed. */
  public int insertIfAbsent(CompletionRecord record) {
    final String sql =
        """
        INSERT INTO completion_records (owner_id, recipient_address, recipient_name, completed_at)
        VALUES (:ownerId, :recipientAddress, :recipientName, :completedAt)
        ON CONFLICT (owner_id, recipient_address) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", record.ownerId())
            .addValue("recipientAddress", record.recipientAddress())
            .addValue("recipientName", record.recipientName())
            .addValue("completedAt", toTimestamp(record.completedAt()));
    return jdbcTemplate.update(sql, params);
  }

  public List<CompletionRecord> findByOwner(String ownerId) {
    final String sql =
        """
        SELECT owner_id, recipient_address, recipient_name, completed_at
        FROM completion_records
        WHERE owner_id = :ownerId
        ORDER BY completed_at DESC
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new CompletionRecord(
                rs.getString("owner_id"),
                rs.getString("recipient_address"),
                rs.getString("recipient_name"),
                toInstant(rs.getTimestamp("completed_at"))));
  }

  public List<String> findRecipientAddresses(String ownerId) {
    final String sql =
        "SELECT recipient_address FROM completion_records WHERE owner_id = :ownerId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }
}
