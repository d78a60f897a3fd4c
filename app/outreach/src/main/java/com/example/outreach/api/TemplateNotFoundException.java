package com.example.outreach.api;

public class TemplateNotFoundException extends RuntimeException {
  public TemplateNotFoundException(String message) {
    super(message);
  }
}
