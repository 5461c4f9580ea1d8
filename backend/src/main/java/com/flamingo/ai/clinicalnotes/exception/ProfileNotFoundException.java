package com.flamingo.ai.clinicalnotes.exception;

/** Exception thrown when an EMR profile id is not in the catalog. */
public class ProfileNotFoundException extends RuntimeException {

  private final String profileId;

  public ProfileNotFoundException(String profileId) {
    super("EMR profile not found: " + profileId);
    this.profileId = profileId;
  }

  public String getProfileId() {
    return profileId;
  }
}
