package com.example.outreach.api;

import com.example.outreach.api.request.ProfileRequest;
import com.example.outreach.api.response.ProfileResponse;
import com.example.outreach.config.RequestMdcInterceptor;
import com.example.outreach.model.OwnerProfile;
import com.example.outreach.service.OwnerProfileService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/profile")
@RequiredArgsConstructor
public class ProfileController {

  private static final String HEADER_USER_ID = RequestMdcInterceptor.HEADER_USER_ID;

  private final OwnerProfileService profileService;

  @GetMapping
  public ResponseEntity<ProfileResponse> get(@RequestHeader(HEADER_USER_ID) String ownerId) {
    return profileService
        .find(ownerId)
        .map(profile -> ResponseEntity.ok(ProfileResponse.from(profile)))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PutMapping
  public ProfileResponse save(
      @RequestHeader(HEADER_USER_ID) String ownerId, @Valid @RequestBody ProfileRequest request) {
    final OwnerProfile profile =
        new OwnerProfile(
            ownerId,
            request.fullName(),
            request.position(),
            request.companyName(),
            request.companyDescription(),
            request.contactInfo(),
            request.followupIntervalDays(),
            request.lastchanceIntervalDays(),
            request.shareContacts());
    return ProfileResponse.from(profileService.save(profile));
  }
}
