package com.flamingo.ai.clinicalnotes.config;

import com.flamingo.ai.clinicalnotes.service.compliance.EmrProfileRegistry;
import com.flamingo.ai.clinicalnotes.service.compliance.catalog.ProfileCatalogLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Loads the EMR profile catalog once at start-up. */
@Configuration
public class ProfileCatalogConfig {

  @Bean
  public EmrProfileRegistry emrProfileRegistry(ProfileCatalogLoader loader, NoteConfig noteConfig) {
    NoteConfig.Profiles profiles = noteConfig.getProfiles();
    return new EmrProfileRegistry(
        loader.load(profiles.getCatalog()), profiles.getDefaultProfile());
  }
}
