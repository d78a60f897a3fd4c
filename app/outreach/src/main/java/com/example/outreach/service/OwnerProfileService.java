package com.example.outreach.service;

import com.example.outreach.model.OwnerProfile;
import com.example.outreach.repository.OwnerProfileRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OwnerProfileService {

  static final int MIN_INTERVAL_DAYS = 1;
  static final int MAX_INTERVAL_DAYS = 60;

  private final OwnerProfileRepository profileRepository;
  private final Clock clock;

  public Optional<OwnerProfile> find(String ownerId) {
    return profileRepository.find(ownerId);
  }

  /**
   * Stores the profile. Interval days, when given, must lie in [1, 60] and the last chance
   * interval must be longer than the follow-up interval.
   */
  public OwnerProfile save(OwnerProfile profile) {
    validateInterval("followup_interval_days", profile.followupIntervalDays());
    validateInterval("lastchance_interval_days", profile.lastchanceIntervalDays());
    if (profile.followupIntervalDays() != null
        && profile.lastchanceIntervalDays() != null
        && profile.lastchanceIntervalDays() <= profile.followupIntervalDays()) {
      throw new IllegalArgumentException(
          "lastchance_interval_days must be greater than followup_interval_days");
    }
    profileRepository.upsert(profile, Instant.now(clock));
    return profile;
  }

  private void validateInterval(String field, Integer days) {
    if (days == null) {
      return;
    }
    if (days < MIN_INTERVAL_DAYS || days > MAX_INTERVAL_DAYS) {
      throw new IllegalArgumentException(
          field + " must be between " + MIN_INTERVAL_DAYS + " and " + MAX_INTERVAL_DAYS);
    }
  }
}
