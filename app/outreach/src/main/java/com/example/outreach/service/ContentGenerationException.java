package com.example.outreach.service;

public class ContentGenerationException extends RuntimeException {
  public ContentGenerationException(String message) {
    super(message);
  }
}
