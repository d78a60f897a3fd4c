package com.example.outreach.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemplateRequest(
    @NotBlank(message = "name is required") @Size(max = 200, message = "name is too long")
        String name,
    @NotBlank(message = "category is required") String category,
    @NotBlank(message = "subject is required") String subject,
    @NotBlank(message = "body is required") String body,
    boolean makeDefault) {}
