package com.example.outreach.api;

import java.util.UUID;

public class EmailNotFoundException extends RuntimeException {
  public EmailNotFoundException(UUID emailId) {
    super("email not found: " + emailId);
  }
}
