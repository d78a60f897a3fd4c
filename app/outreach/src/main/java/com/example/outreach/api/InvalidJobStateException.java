package com.example.outreach.api;

import com.example.outreach.model.JobStatus;
import java.util.Locale;
import java.util.UUID;

/** Pause, resume or cancel requested for a job that is no longer processing. */
public class InvalidJobStateException extends RuntimeException {
  public InvalidJobStateException(UUID jobId, JobStatus status) {
    super("job " + jobId + " is " + status.name().toLowerCase(Locale.ROOT));
  }
}
