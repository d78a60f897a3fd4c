package com.example.outreach.api;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {
  public JobNotFoundException(UUID jobId) {
    super("job not found: " + jobId);
  }
}
