package com.example.outreach.service;

/** The governor refused a send; the message is the governor's reason. */
public class QuotaDeniedException extends RuntimeException {
  public QuotaDeniedException(String reason) {
    super(reason);
  }
}
