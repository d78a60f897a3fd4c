package com.example.outreach.api.request;

import com.example.outreach.model.Contact;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** One contact row; a missing or malformed email is reported per item, not rejected here. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ContactPayload(
    String email,
    String firstName,
    String lastName,
    String company,
    String title,
    String website,
    String industry) {

  public Contact toContact() {
    return new Contact(email, firstName, lastName, company, title, website, industry);
  }
}
