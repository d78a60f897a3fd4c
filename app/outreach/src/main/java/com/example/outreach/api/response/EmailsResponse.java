package com.example.outreach.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EmailsResponse(List<EmailResponse> emails) {
  public EmailsResponse {
    emails = emails == null ? List.of() : List.copyOf(emails);
  }
}
