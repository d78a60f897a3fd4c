package com.example.outreach.api.response;

import com.example.outreach.model.EmailTemplate;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Objects;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemplateResponse(
    UUID templateId,
    String name,
    String category,
    String subject,
    String body,
    boolean defaultTemplate,
    String createdAt,
    String updatedAt) {

  public static TemplateResponse from(EmailTemplate template) {
    return new TemplateResponse(
        template.templateId(),
        template.name(),
        template.category().category(),
        template.subject(),
        template.body(),
        template.isDefault(),
        Objects.toString(template.createdAt(), null),
        Objects.toString(template.updatedAt(), null));
  }
}
