package com.example.outreach.model;

import java.util.Locale;

/** One row of an uploaded contact list. */
public record Contact(
    String email,
    String firstName,
    String lastName,
    String company,
    String title,
    String website,
    String industry) {

  public String recipientName() {
    final String first = firstName == null ? "" : firstName.trim();
    final String last = lastName == null ? "" : lastName.trim();
    return (first + " " + last).trim();
  }

  public boolean hasValidEmail() {
    if (email == null) {
      return false;
    }
    final String trimmed = email.trim();
    final int at = trimmed.indexOf('@');
    return at > 0 && at < trimmed.length() - 1;
  }

  public String normalizedEmail() {
    return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
  }

  /** Rebuilds the contact fields an existing email still carries. */
  public static Contact fromEmail(EmailRecord email) {
    final String name = email.recipientName() == null ? "" : email.recipientName().trim();
    final int space = name.indexOf(' ');
    final String first = space < 0 ? name : name.substring(0, space);
    final String last = space < 0 ? "" : name.substring(space + 1).trim();
    return new Contact(
        email.recipientAddress(), first, last, email.recipientCompany(), null, null, null);
  }
}
