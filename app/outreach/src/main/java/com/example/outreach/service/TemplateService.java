/*
 * Where: Outreach service layer
 * What: per-category template catalog with a single default
 * Why: generation and next-stage creation fall back to the category default
 */
package com.example.outreach.service;

import com.example.outreach.api.TemplateLimitExceededException;
import com.example.outreach.api.TemplateNotFoundException;
import com.example.outreach.model.EmailStage;
import com.example.outreach.model.EmailTemplate;
import com.example.outreach.repository.TemplateRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class TemplateService {

  private static final Logger logger = LoggerFactory.getLogger(TemplateService.class);
  static final int MAX_TEMPLATES_PER_CATEGORY = 3;

  private final TemplateRepository templateRepository;
  private final Clock clock;

  @Transactional
  public EmailTemplate create(
      String ownerId,
      String name,
      EmailStage category,
      String subject,
      String body,
      boolean makeDefault) {
    final int existing = templateRepository.countByCategory(ownerId, category);
    if (existing >= MAX_TEMPLATES_PER_CATEGORY) {
      throw new TemplateLimitExceededException(category, MAX_TEMPLATES_PER_CATEGORY);
    }
    final Instant now = Instant.now(clock);
    final boolean isDefault = existing == 0 || makeDefault;
    if (isDefault) {
      templateRepository.clearDefault(ownerId, category, now);
    }
    final EmailTemplate template =
        new EmailTemplate(
            UUID.randomUUID(), ownerId, name, category, subject, body, isDefault, now, now);
    templateRepository.insert(template);
    logger.info(
        "template created templateId={} category={} default={}",
        template.templateId(),
        category.category(),
        isDefault);
    return template;
  }

  public List<EmailTemplate> list(String ownerId, EmailStage category) {
    return templateRepository.findByOwner(ownerId, category);
  }

  @Transactional
  public EmailTemplate markDefault(String ownerId, UUID templateId) {
    final EmailTemplate template = load(ownerId, templateId);
    if (template.isDefault()) {
      return template;
    }
    final Instant now = Instant.now(clock);
    templateRepository.clearDefault(ownerId, template.category(), now);
    templateRepository.markDefault(templateId, now);
    logger.info(
        "template marked default templateId={} category={}",
        templateId,
        template.category().category());
    return load(ownerId, templateId);
  }

  /** Deletes a template; when it was the default the newest remaining one takes over. */
  @Transactional
  public void delete(String ownerId, UUID templateId) {
    final EmailTemplate template = load(ownerId, templateId);
    templateRepository.delete(templateId, ownerId);
    if (!template.isDefault()) {
      return;
    }
    templateRepository.findByOwner(ownerId, template.category()).stream()
        .findFirst()
        .ifPresent(
            successor -> {
              templateRepository.markDefault(successor.templateId(), Instant.now(clock));
              logger.info(
                  "default template promoted templateId={} category={}",
                  successor.templateId(),
                  successor.category().category());
            });
  }

  private EmailTemplate load(String ownerId, UUID templateId) {
    return templateRepository
        .findByIdAndOwner(templateId, ownerId)
        .orElseThrow(() -> new TemplateNotFoundException("template not found: " + templateId));
  }
}
