/*
 * Where: Outreach data access
 * What: CRUD for email templates and the default-per-category flag
 * Why: generation and next-stage creation resolve content from here
 */
package com.example.outreach.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailTemplate;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TemplateRepository {

  private static final String COLUMNS =
      "template_id, owner_id, name, category, subject, body, is_default, created_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(EmailTemplate template) {
    final String sql =
        """
        INSERT INTO email_templates (
          template_id, owner_id, name, category, subject, body, is_default, created_at, updated_at
        ) VALUES (
          :templateId, :ownerId, :name, :category, :subject, :body, :isDefault, :createdAt, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("templateId", template.templateId())
            .addValue("ownerId", template.ownerId())
            .addValue("name", template.name())
            .addValue("category", template.category().category())
            .addValue("subject", template.subject())
            .addValue("body", template.body())
            .addValue("isDefault", template.isDefault())
            .addValue("createdAt", toTimestamp(template.createdAt()))
            .addValue("updatedAt", toTimestamp(template.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<EmailTemplate> findByIdAndOwner(UUID templateId, String ownerId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM email_templates WHERE template_id = :templateId AND owner_id = :ownerId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("templateId", templateId).addValue("ownerId", ownerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<EmailTemplate> findByOwner(String ownerId, EmailStage category) {
    final StringBuilder sql =
        new StringBuilder("SELECT ")
            .append(COLUMNS)
            .append(" FROM email_templates WHERE owner_id = :ownerId");
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    if (category != null) {
      sql.append(" AND category = :category");
      params.addValue("category", category.category());
    }
    sql.append(" ORDER BY category, created_at DESC");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public Optional<EmailTemplate> findDefault(String ownerId, EmailStage category) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM email_templates WHERE owner_id = :ownerId AND category = :category"
            + " AND is_default";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("category", category.category());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int countByCategory(String ownerId, EmailStage category) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM email_templates
        WHERE owner_id = :ownerId
          AND category = :category
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("category", category.category());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  public Set<EmailStage> findCategories(String ownerId) {
    final String sql =
        "SELECT DISTINCT category FROM email_templates WHERE owner_id = :ownerId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    return Set.copyOf(
        jdbcTemplate.query(
            sql, params, (rs, rowNum) -> EmailStage.fromValue(rs.getString("category"))));
  }

  public int clearDefault(String ownerId, EmailStage category, Instant now) {
    final String sql =
        """
        UPDATE email_templates
        SET is_default = FALSE,
            updated_at = :now
        WHERE owner_id = :ownerId
          AND category = :category
          AND is_default
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("category", category.category())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markDefault(UUID templateId, Instant now) {
    final String sql =
        """
        UPDATE email_templates
        SET is_default = TRUE,
            updated_at = :now
        WHERE template_id = :templateId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("templateId", templateId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(UUID templateId, String ownerId) {
    final String sql =
        "DELETE FROM email_templates WHERE template_id = :templateId AND owner_id = :ownerId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("templateId", templateId).addValue("ownerId", ownerId);
    return jdbcTemplate.update(sql, params);
  }

  private EmailTemplate mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new EmailTemplate(
        UUID.fromString(rs.getString("template_id")),
        rs.getString("owner_id"),
        rs.getString("name"),
        EmailStage.fromValue(rs.getString("category")),
        rs.getString("subject"),
        rs.getString("body"),
        rs.getBoolean("is_default"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
