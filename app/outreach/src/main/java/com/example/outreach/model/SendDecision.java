package com.example.outreach.model;

public record SendDecision(boolean allowed, String reason, String warning) {

  public static SendDecision deny(String reason) {
    return new SendDecision(false, reason, null);
  }

  public static SendDecision allow(String reason, String warning) {
    return new SendDecision(true, reason, warning);
  }
}
