package com.example.outreach.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProfileRequest(
    @Size(max = 200, message = "full_name is too long") String fullName,
    @Size(max = 200, message = "position is too long") String position,
    @Size(max = 200, message = "company_name is too long") String companyName,
    String companyDescription,
    String contactInfo,
    Integer followupIntervalDays,
    Integer lastchanceIntervalDays,
    boolean shareContacts) {}
