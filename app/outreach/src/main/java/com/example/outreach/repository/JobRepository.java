/*
 * Where: Outreach data access
 * What: persists jobs and their progress checkpoints
 * Why: progress counters must stay monotone and terminal states immutable
 */
package com.example.outreach.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.outreach.model.EmailStage;
import com.example.outreach.model.JobKind;
import com.example.outreach.model.JobRecord;
import com.example.outreach.model.JobStatus;
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
public class JobRepository {

  private static final String COLUMNS =
      """
      job_id, owner_id, kind, group_id, stage, template_id, avoid_duplicates, include_collaborators,
      total_items, processed_items, success_count, status, paused, error_message, warning_message,
      created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(JobRecord record, String itemsJson) {
    final String sql =
        """
        INSERT INTO jobs (
          job_id, owner_id, kind, group_id, stage, template_id, avoid_duplicates, include_collaborators,
          items_json, total_items, processed_items, success_count, status, paused,
          error_message, warning_message, created_at, updated_at
        ) VALUES (
          :jobId, :ownerId, :kind, :groupId, :stage, :templateId, :avoidDuplicates, :includeCollaborators,
          :itemsJson::jsonb, :totalItems, :processedItems, :successCount, :status, :paused,
          :errorMessage, :warningMessage, :createdAt, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", record.jobId())
            .addValue("ownerId", record.ownerId())
            .addValue("kind", record.kind().name())
            .addValue("groupId", record.groupId())
            .addValue("stage", record.stage().value())
            .addValue("templateId", record.templateId())
            .addValue("avoidDuplicates", record.avoidDuplicates())
            .addValue("includeCollaborators", record.includeCollaborators())
            .addValue("itemsJson", itemsJson)
            .addValue("totalItems", record.totalItems())
            .addValue("processedItems", record.processedItems())
            .addValue("successCount", record.successCount())
            .addValue("status", record.status().name())
            .addValue("paused", record.paused())
            .addValue("errorMessage", record.errorMessage())
            .addValue("warningMessage", record.warningMessage())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<JobRecord> findById(UUID jobId) {
    final String sql = "SELECT " + COLUMNS + " FROM jobs WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<JobRecord> findByIdAndOwner(UUID jobId, String ownerId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM jobs WHERE job_id = :jobId AND owner_id = :ownerId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("ownerId", ownerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<String> findItemsJson(UUID jobId) {
    final String sql = "SELECT items_json::text AS items_json_text FROM jobs WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> rs.getString("items_json_text"))
        .stream()
        .findFirst();
  }

  public List<UUID> findProcessingIds() {
    final String sql =
        "SELECT job_id FROM jobs WHERE status = 'PROCESSING' ORDER BY created_at";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource(), (rs, rowNum) -> UUID.fromString(rs.getString("job_id")));
  }

  /**
   * Writes a progress checkpoint and never moves the counters backwards. A cancelled job still
   * accepts the checkpoint of the item that was in flight when it was cancelled.
   */
  public int updateProgress(UUID jobId, int processedItems, int successCount, Instant now) {
    final String sql =
        """
        UPDATE jobs
        SET processed_items = :processedItems,
            success_count = :successCount,
            updated_at = :now
        WHERE job_id = :jobId
          AND status IN ('PROCESSING', 'CANCELLED')
          AND processed_items <= :processedItems
          AND success_count <= :successCount
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("processedItems", processedItems)
            .addValue("successCount", successCount)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markCompleted(UUID jobId, Instant now) {
    return transitionFromProcessing(jobId, JobStatus.COMPLETED, null, now);
  }

  public int markError(UUID jobId, String errorMessage, Instant now) {
    return transitionFromProcessing(jobId, JobStatus.ERROR, errorMessage, now);
  }

  public int cancel(UUID jobId, String ownerId, Instant now) {
    final String sql =
        """
        UPDATE jobs
        SET status = 'CANCELLED',
            paused = FALSE,
            updated_at = :now
        WHERE job_id = :jobId
          AND owner_id = :ownerId
          AND status = 'PROCESSING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("ownerId", ownerId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** Flips the pause flag; only a processing job can be paused or resumed. */
  public int setPaused(UUID jobId, String ownerId, boolean paused, Instant now) {
    final String sql =
        """
        UPDATE jobs
        SET paused = :paused,
            updated_at = :now
        WHERE job_id = :jobId
          AND owner_id = :ownerId
          AND status = 'PROCESSING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("ownerId", ownerId)
            .addValue("paused", paused)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int setWarningIfAbsent(UUID jobId, String warningMessage, Instant now) {
    final String sql =
        """
        UPDATE jobs
        SET warning_message = :warningMessage,
            updated_at = :now
        WHERE job_id = :jobId
          AND warning_message IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("warningMessage", warningMessage)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteTerminalOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM jobs
        WHERE updated_at < :threshold
          AND status IN ('COMPLETED', 'ERROR', 'CANCELLED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleProcessing(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM jobs
        WHERE updated_at < :threshold
          AND status = 'PROCESSING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private int transitionFromProcessing(
      UUID jobId, JobStatus target, String errorMessage, Instant now) {
    final String sql =
        """
        UPDATE jobs
        SET status = :status,
            paused = FALSE,
            error_message = COALESCE(:errorMessage, error_message),
            updated_at = :now
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("status", target.name())
            .addValue("errorMessage", errorMessage)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String groupId = rs.getString("group_id");
    final String templateId = rs.getString("template_id");
    return new JobRecord(
        UUID.fromString(rs.getString("job_id")),
        rs.getString("owner_id"),
        JobKind.valueOf(rs.getString("kind")),
        groupId == null ? null : UUID.fromString(groupId),
        EmailStage.fromValue(rs.getString("stage")),
        templateId == null ? null : UUID.fromString(templateId),
        rs.getBoolean("avoid_duplicates"),
        rs.getBoolean("include_collaborators"),
        rs.getInt("total_items"),
        rs.getInt("processed_items"),
        rs.getInt("success_count"),
        JobStatus.valueOf(rs.getString("status")),
        rs.getBoolean("paused"),
        rs.getString("error_message"),
        rs.getString("warning_message"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
