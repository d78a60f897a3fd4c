/*
 * Where: Outreach delivery boundary
 * What: failure reported by the mail transport
 * Why: credential failures must be told apart from transient ones
 */
package com.example.outreach.service;

public class DeliveryException extends RuntimeException {

  public enum Kind {
    FAILURE,
    TOKEN_INVALID
  }

  private final Kind kind;

  public DeliveryException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public DeliveryException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  public boolean isTokenInvalid() {
    return kind == Kind.TOKEN_INVALID;
  }
}
