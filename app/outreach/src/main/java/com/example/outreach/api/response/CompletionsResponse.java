package com.example.outreach.api.response;

import com.example.outreach.model.CompletionRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Objects;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CompletionsResponse(List<Completion> completions) {

  public CompletionsResponse {
    completions = completions == null ? List.of() : List.copyOf(completions);
  }

  public static CompletionsResponse from(List<CompletionRecord> records) {
    return new CompletionsResponse(
        records.stream()
            .map(
                record ->
                    new Completion(
                        record.recipientAddress(),
                        record.recipientName(),
                        Objects.toString(record.completedAt(), null)))
            .toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Completion(String recipientAddress, String recipientName, String completedAt) {}
}
