package com.example.outreach.model;

public enum JobStatus {
  PROCESSING,
  COMPLETED,
  ERROR,
  CANCELLED;

  public boolean isTerminal() {
    return this != PROCESSING;
  }
}
