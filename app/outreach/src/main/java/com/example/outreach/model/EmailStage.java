/*
 * Where: Outreach domain model
 * What: the three sequential stages a recipient moves through
 * Why: stage order drives which email is spawned after a send
 */
package com.example.outreach.model;

import java.util.Locale;
import java.util.Optional;

public enum EmailStage {
  OUTREACH("outreach"),
  FOLLOWUP("followup"),
  LASTCHANCE("lastchance");

  private final String value;

  EmailStage(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Template category that supplies content for this stage. */
  public String category() {
    return value;
  }

  public Optional<EmailStage> next() {
    return switch (this) {
      case OUTREACH -> Optional.of(FOLLOWUP);
      case FOLLOWUP -> Optional.of(LASTCHANCE);
      case LASTCHANCE -> Optional.empty();
    };
  }

  /** The "due to be sent" status of an unsent email in this stage. */
  public EmailStatus dueStatus() {
    return switch (this) {
      case OUTREACH -> EmailStatus.OUTREACH_PENDING;
      case FOLLOWUP -> EmailStatus.FOLLOWUP_DUE;
      case LASTCHANCE -> EmailStatus.LASTCHANCE_DUE;
    };
  }

  /** Status an email of this stage takes once it has been sent. */
  public EmailStatus sentStatus() {
    return next().map(EmailStage::dueStatus).orElse(EmailStatus.COMPLETED);
  }

  public static EmailStage fromValue(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("stage is required");
    }
    final String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (EmailStage stage : values()) {
      if (stage.value.equals(normalized)) {
        return stage;
      }
    }
    throw new IllegalArgumentException("unsupported stage: " + raw);
  }
}
