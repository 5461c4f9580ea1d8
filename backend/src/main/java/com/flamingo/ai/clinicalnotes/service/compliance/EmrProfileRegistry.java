package com.flamingo.ai.clinicalnotes.service.compliance;

import com.flamingo.ai.clinicalnotes.exception.ProfileNotFoundException;
import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Read-only catalog of EMR profiles, keyed by id. */
public class EmrProfileRegistry {

  private final Map<String, EmrProfile> profiles;
  private final String defaultProfileId;

  public EmrProfileRegistry(Collection<EmrProfile> profiles, String defaultProfileId) {
    Map<String, EmrProfile> byId = new LinkedHashMap<>();
    for (EmrProfile profile : profiles) {
      if (byId.putIfAbsent(profile.id(), profile) != null) {
        throw new IllegalStateException("Duplicate EMR profile id: " + profile.id());
      }
    }
    if (!byId.containsKey(defaultProfileId)) {
      throw new IllegalStateException(
          "Default EMR profile '" + defaultProfileId + "' is not in the catalog " + byId.keySet());
    }
    this.profiles = byId;
    this.defaultProfileId = defaultProfileId;
  }

  /**
   * Returns the profile with the given id.
   *
   * @throws ProfileNotFoundException if no profile has that id
   */
  public EmrProfile get(String id) {
    return find(id).orElseThrow(() -> new ProfileNotFoundException(id));
  }

  public Optional<EmrProfile> find(String id) {
    return id == null ? Optional.empty() : Optional.ofNullable(profiles.get(id));
  }

  /** Returns the profile with the given id, or the default profile when the id is blank. */
  public EmrProfile getOrDefault(String id) {
    return id == null || id.isBlank() ? defaultProfile() : get(id);
  }

  public EmrProfile defaultProfile() {
    return profiles.get(defaultProfileId);
  }

  public List<EmrProfile> all() {
    return List.copyOf(profiles.values());
  }
}
