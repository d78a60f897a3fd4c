/*
 * Where: Outreach API
 * What: a batch request whose prerequisites are not met
 * Why: rejected synchronously before any background work starts
 */
package com.example.outreach.api;

public class PreconditionFailedException extends RuntimeException {
  public PreconditionFailedException(String message) {
    super(message);
  }
}
