package com.example.outreach.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SendCheckRequest(
    @NotNull(message = "recipient_count is required")
        @Positive(message = "recipient_count must be positive")
        Integer recipientCount) {}
