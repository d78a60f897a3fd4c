package com.example.outreach.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BounceRequest(
    @NotBlank(message = "recipient_address is required") String recipientAddress,
    String reason) {}
