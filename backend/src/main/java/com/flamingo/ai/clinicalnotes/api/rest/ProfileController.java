package com.flamingo.ai.clinicalnotes.api.rest;

import com.flamingo.ai.clinicalnotes.api.dto.response.ProfileResponse;
import com.flamingo.ai.clinicalnotes.service.compliance.EmrProfileRegistry;
import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the EMR profile catalog. */
@RestController
@RequestMapping("/api/profiles")
@RequiredArgsConstructor
public class ProfileController {

  private final EmrProfileRegistry profileRegistry;

  /** Lists all EMR profiles. */
  @GetMapping
  public ResponseEntity<List<ProfileResponse>> getAllProfiles() {
    String defaultId = profileRegistry.defaultProfile().id();
    return ResponseEntity.ok(
        profileRegistry.all().stream()
            .map(profile -> ProfileResponse.fromProfile(profile, profile.id().equals(defaultId)))
            .toList());
  }

  /** Gets an EMR profile by id. */
  @GetMapping("/{profileId}")
  public ResponseEntity<ProfileResponse> getProfile(@PathVariable String profileId) {
    EmrProfile profile = profileRegistry.get(profileId);
    boolean isDefault = profile.id().equals(profileRegistry.defaultProfile().id());
    return ResponseEntity.ok(ProfileResponse.fromProfile(profile, isDefault));
  }
}
