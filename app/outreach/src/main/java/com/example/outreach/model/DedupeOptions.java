package com.example.outreach.model;

public record DedupeOptions(boolean avoidDuplicates, boolean includeCollaborators) {

  public static DedupeOptions none() {
    return new DedupeOptions(false, false);
  }
}
