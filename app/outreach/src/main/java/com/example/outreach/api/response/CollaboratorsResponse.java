package com.example.outreach.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CollaboratorsResponse(String ownerId, List<String> collaborators) {
  public CollaboratorsResponse {
    collaborators = collaborators == null ? List.of() : List.copyOf(collaborators);
  }
}
