package com.example.outreach.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.outreach.api.TemplateLimitExceededException;
import com.example.outreach.api.TemplateNotFoundException;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailTemplate;
import com.example.outreach.repository.TemplateRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TemplateServiceTest {

  private static final String OWNER = "owner-1";
  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private TemplateRepository templateRepository;

  private TemplateService service;

  @BeforeEach
  void setUp() {
    service = new TemplateService(templateRepository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void firstTemplateOfACategoryBecomesDefault() {
    when(templateRepository.countByCategory(OWNER, EmailStage.FOLLOWUP)).thenReturn(0);

    final EmailTemplate created =
        service.create(OWNER, "Nudge", EmailStage.FOLLOWUP, "Re: {{company}}", "Hi", false);

    assertThat(created.isDefault()).isTrue();
    final InOrder order = inOrder(templateRepository);
    order.verify(templateRepository).clearDefault(OWNER, EmailStage.FOLLOWUP, NOW);
    order.verify(templateRepository).insert(created);
  }

  @Test
  void laterTemplateIsNotDefaultUnlessAsked() {
    when(templateRepository.countByCategory(OWNER, EmailStage.OUTREACH)).thenReturn(1);

    final EmailTemplate created =
        service.create(OWNER, "Alt", EmailStage.OUTREACH, "Subject", "Body", false);

    assertThat(created.isDefault()).isFalse();
    verify(templateRepository, never()).clearDefault(any(), any(), any());
  }

  @Test
  void fourthTemplateInACategoryIsRejected() {
    when(templateRepository.countByCategory(OWNER, EmailStage.OUTREACH)).thenReturn(3);

    assertThatThrownBy(
            () -> service.create(OWNER, "Extra", EmailStage.OUTREACH, "Subject", "Body", true))
        .isInstanceOf(TemplateLimitExceededException.class)
        .hasMessage("at most 3 templates are allowed for category outreach");
    verify(templateRepository, never()).insert(any());
  }

  @Test
  void deletingTheDefaultPromotesTheNewestRemaining() {
    final EmailTemplate removed = template(true);
    final EmailTemplate newest = template(false);
    final EmailTemplate older = template(false);
    when(templateRepository.findByIdAndOwner(removed.templateId(), OWNER))
        .thenReturn(Optional.of(removed));
    when(templateRepository.findByOwner(OWNER, EmailStage.OUTREACH))
        .thenReturn(List.of(newest, older));

    service.delete(OWNER, removed.templateId());

    verify(templateRepository).delete(removed.templateId(), OWNER);
    verify(templateRepository).markDefault(newest.templateId(), NOW);
  }

  @Test
  void deletingANonDefaultLeavesTheDefaultAlone() {
    final EmailTemplate removed = template(false);
    when(templateRepository.findByIdAndOwner(removed.templateId(), OWNER))
        .thenReturn(Optional.of(removed));

    service.delete(OWNER, removed.templateId());

    verify(templateRepository, never()).markDefault(any(), any());
  }

  @Test
  void markDefaultSwapsTheCategoryDefault() {
    final EmailTemplate target = template(false);
    final EmailTemplate promoted =
        new EmailTemplate(
            target.templateId(), OWNER, "t", EmailStage.OUTREACH, "s", "b", true, NOW, NOW);
    when(templateRepository.findByIdAndOwner(target.templateId(), OWNER))
        .thenReturn(Optional.of(target))
        .thenReturn(Optional.of(promoted));

    assertThat(service.markDefault(OWNER, target.templateId()).isDefault()).isTrue();
    verify(templateRepository).clearDefault(OWNER, EmailStage.OUTREACH, NOW);
    verify(templateRepository).markDefault(target.templateId(), NOW);
  }

  @Test
  void unknownTemplateIsNotFound() {
    final UUID templateId = UUID.randomUUID();
    when(templateRepository.findByIdAndOwner(templateId, OWNER)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.markDefault(OWNER, templateId))
        .isInstanceOf(TemplateNotFoundException.class);
  }

  private static EmailTemplate template(boolean isDefault) {
    return new EmailTemplate(
        UUID.randomUUID(), OWNER, "t", EmailStage.OUTREACH, "s", "b", isDefault, NOW, NOW);
  }
}
