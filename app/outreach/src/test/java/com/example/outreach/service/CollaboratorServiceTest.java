package com.example.outreach.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.outreach.repository.CollaboratorRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CollaboratorServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

  @Mock private CollaboratorRepository collaboratorRepository;

  private CollaboratorService service;

  @BeforeEach
  void setUp() {
    service = new CollaboratorService(collaboratorRepository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void addReportsWhetherTheLinkIsNew() {
    when(collaboratorRepository.insertIfAbsent("owner-1", "owner-2", NOW)).thenReturn(1, 0);

    assertThat(service.add("owner-1", "owner-2")).isTrue();
    assertThat(service.add("owner-1", "owner-2")).isFalse();
  }

  @Test
  void selfLinkIsRejected() {
    assertThatThrownBy(() -> service.add("owner-1", "owner-1"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("themselves");
    verifyNoInteractions(collaboratorRepository);
  }

  @Test
  void blankCollaboratorIsRejected() {
    assertThatThrownBy(() -> service.remove("owner-1", " "))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(collaboratorRepository);
  }

  @Test
  void removeDelegatesToRepository() {
    when(collaboratorRepository.delete("owner-1", "owner-2")).thenReturn(1);

    assertThat(service.remove("owner-1", "owner-2")).isTrue();
    verify(collaboratorRepository).delete("owner-1", "owner-2");
  }
}
