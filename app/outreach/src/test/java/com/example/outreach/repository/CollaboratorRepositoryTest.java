package com.example.outreach.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.outreach.AbstractPostgresContainerTest;
import com.example.outreach.model.OwnerProfile;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CollaboratorRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

  @Autowired private CollaboratorRepository collaboratorRepository;

  @Autowired private OwnerProfileRepository profileRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM owner_collaborators", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM owner_profiles", new MapSqlParameterSource());
  }

  @Test
  void linkIsSymmetricAndStoredOnce() {
    assertThat(collaboratorRepository.insertIfAbsent("zed", "amy", NOW)).isEqualTo(1);
    assertThat(collaboratorRepository.insertIfAbsent("amy", "zed", NOW)).isZero();

    assertThat(collaboratorRepository.findCollaborators("amy")).containsExactly("zed");
    assertThat(collaboratorRepository.findCollaborators("zed")).containsExactly("amy");

    assertThat(collaboratorRepository.delete("amy", "zed")).isEqualTo(1);
    assertThat(collaboratorRepository.findCollaborators("zed")).isEmpty();
  }

  @Test
  void sharingCollaboratorsRequireTheOptIn() {
    collaboratorRepository.insertIfAbsent("amy", "bob", NOW);
    collaboratorRepository.insertIfAbsent("amy", "cat", NOW);
    profileRepository.upsert(profile("bob", true), NOW);
    profileRepository.upsert(profile("cat", false), NOW);

    assertThat(collaboratorRepository.findSharingCollaborators("amy")).containsExactly("bob");
  }

  private static OwnerProfile profile(String ownerId, boolean shareContacts) {
    return new OwnerProfile(
        ownerId, "Name", "Role", "Company", null, null, null, null, shareContacts);
  }
}
