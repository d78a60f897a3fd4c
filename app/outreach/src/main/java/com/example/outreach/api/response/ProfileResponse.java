package com.example.outreach.api.response;

import com.example.outreach.model.OwnerProfile;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProfileResponse(
    String ownerId,
    String fullName,
    String position,
    String companyName,
    String companyDescription,
    String contactInfo,
    Integer followupIntervalDays,
    Integer lastchanceIntervalDays,
    boolean shareContacts,
    boolean complete) {

  public static ProfileResponse from(OwnerProfile profile) {
    return new ProfileResponse(
        profile.ownerId(),
        profile.fullName(),
        profile.position(),
        profile.companyName(),
        profile.companyDescription(),
        profile.contactInfo(),
        profile.followupIntervalDays(),
        profile.lastchanceIntervalDays(),
        profile.shareContacts(),
        profile.isComplete());
  }
}
