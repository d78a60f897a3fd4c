package com.example.outreach.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Symmetric collaborator pairs, stored once with the smaller id in owner_a. */
@Repository
@RequiredArgsConstructor
public class CollaboratorRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insertIfAbsent(String ownerId, String collaboratorId, Instant now) {
    final String sql =
        """
        INSERT INTO owner_collaborators (owner_a, owner_b, created_at)
        VALUES (:ownerA, :ownerB, :now)
        ON CONFLICT (owner_a, owner_b) DO NOTHING
        """;
    return jdbcTemplate.update(
        sql, pairParams(ownerId, collaboratorId).addValue("now", toTimestamp(now)));
  }

  public int delete(String ownerId, String collaboratorId) {
    final String sql =
        "DELETE FROM owner_collaborators WHERE owner_a = :ownerA AND owner_b = :ownerB";
    return jdbcTemplate.update(sql, pairParams(ownerId, collaboratorId));
  }

  public List<String> findCollaborators(String ownerId) {
    final String sql =
        """
        SELECT owner_b AS collaborator_id FROM owner_collaborators WHERE owner_a = :ownerId
        UNION
        SELECT owner_a AS collaborator_id FROM owner_collaborators WHERE owner_b = :ownerId
        ORDER BY collaborator_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  /** Collaborators of the owner who opted into contact sharing. */
  public List<String> findSharingCollaborators(String ownerId) {
    final String sql =
        """
        SELECT c.collaborator_id
        FROM (
          SELECT owner_b AS collaborator_id FROM owner_collaborators WHERE owner_a = :ownerId
          UNION
          SELECT owner_a AS collaborator_id FROM owner_collaborators WHERE owner_b = :ownerId
        ) c
        JOIN owner_profiles p ON p.owner_id = c.collaborator_id
        WHERE p.share_contacts
        ORDER BY c.collaborator_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  private MapSqlParameterSource pairParams(String ownerId, String collaboratorId) {
    final boolean ordered = ownerId.compareTo(collaboratorId) < 0;
    return new MapSqlParameterSource()
        .addValue("ownerA", ordered ? ownerId : collaboratorId)
        .addValue("ownerB", ordered ? collaboratorId : ownerId);
  }
}
