package com.example.outreach.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "request DTO is read once by the controller and never shared")
public record GenerateJobRequest(
    @NotEmpty(message = "contacts must not be empty") List<ContactPayload> contacts,
    UUID templateId,
    @NotBlank(message = "stage is required") String stage,
    boolean avoidDuplicates,
    boolean includeCollaborators) {}
