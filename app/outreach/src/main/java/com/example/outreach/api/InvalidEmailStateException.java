package com.example.outreach.api;

public class InvalidEmailStateException extends RuntimeException {
  public InvalidEmailStateException(String message) {
    super(message);
  }
}
