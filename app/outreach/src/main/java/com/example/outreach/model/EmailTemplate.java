package com.example.outreach.model;

import java.time.Instant;
import java.util.UUID;

public record EmailTemplate(
    UUID templateId,
    String ownerId,
    String name,
    EmailStage category,
    String subject,
    String body,
    boolean isDefault,
    Instant createdAt,
    Instant updatedAt) {}
