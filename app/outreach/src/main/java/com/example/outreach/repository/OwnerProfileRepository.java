package com.example.outreach.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.outreach.model.OwnerProfile;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OwnerProfileRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<OwnerProfile> find(String ownerId) {
    final String sql =
        """
        SELECT owner_id, full_name, position, company_name, company_description, contact_info,
               followup_interval_days, lastchance_interval_days, share_contacts
        FROM owner_profiles
        WHERE owner_id = :ownerId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("ownerId", ownerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public void upsert(OwnerProfile profile, Instant now) {
    final String sql =
        """
        INSERT INTO owner_profiles (
          owner_id, full_name, position, company_name, company_description, contact_info,
          followup_interval_days, lastchance_interval_days, share_contacts, updated_at
        ) VALUES (
          :ownerId, :fullName, :position, :companyName, :companyDescription, :contactInfo,
          :followupIntervalDays, :lastchanceIntervalDays, :shareContacts, :now
        )
        ON CONFLICT (owner_id) DO UPDATE
          SET full_name = EXCLUDED.full_name,
              position = EXCLUDED.position,
              company_name = EXCLUDED.company_name,
              company_description = EXCLUDED.company_description,
              contact_info = EXCLUDED.contact_info,
              followup_interval_days = EXCLUDED.followup_interval_days,
              lastchance_interval_days = EXCLUDED.lastchance_interval_days,
              share_contacts = EXCLUDED.share_contacts,
              updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerId", profile.ownerId())
            .addValue("fullName", profile.fullName())
            .addValue("position", profile.position())
            .addValue("companyName", profile.companyName())
            .addValue("companyDescription", profile.companyDescription())
            .addValue("contactInfo", profile.contactInfo())
            .addValue("followupIntervalDays", profile.followupIntervalDays())
            .addValue("lastchanceIntervalDays", profile.lastchanceIntervalDays())
            .addValue("shareContacts", profile.shareContacts())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  private OwnerProfile mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OwnerProfile(
        rs.getString("owner_id"),
        rs.getString("full_name"),
        rs.getString("position"),
        rs.getString("company_name"),
        rs.getString("company_description"),
        rs.getString("contact_info"),
        (Integer) rs.getObject("followup_interval_days"),
        (Integer) rs.getObject("lastchance_interval_days"),
        rs.getBoolean("share_contacts"));
  }
}
