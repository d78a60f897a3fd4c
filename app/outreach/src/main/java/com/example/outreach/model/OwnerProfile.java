/*
 * Where: Outreach domain model
 * What: sender identity used in content and the owner's stage interval settings
 * Why: generation requires a complete profile and due dates come from its intervals
 */
package com.example.outreach.model;

public record OwnerProfile(
    String ownerId,
    String fullName,
    String position,
    String companyName,
    String companyDescription,
    String contactInfo,
    Integer followupIntervalDays,
    Integer lastchanceIntervalDays,
    boolean shareContacts) {

  public boolean isComplete() {
    return hasText(fullName) && hasText(companyName) && hasText(position);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
