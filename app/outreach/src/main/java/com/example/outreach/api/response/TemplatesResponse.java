package com.example.outreach.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TemplatesResponse(List<TemplateResponse> templates) {
  public TemplatesResponse {
    templates = templates == null ? List.of() : List.copyOf(templates);
  }
}
