package com.example.outreach.api;

import com.example.outreach.model.EmailStage;

public class TemplateLimitExceededException extends RuntimeException {
  public TemplateLimitExceededException(EmailStage category, int limit) {
    super("at most " + limit + " templates are allowed for category " + category.category());
  }
}
