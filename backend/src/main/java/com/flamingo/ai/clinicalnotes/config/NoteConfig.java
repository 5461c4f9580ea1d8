package com.flamingo.ai.clinicalnotes.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for note parsing, compliance and selective updates. */
@Configuration
@ConfigurationProperties(prefix = "notes")
@Getter
@Setter
public class NoteConfig {

  private Profiles profiles = new Profiles();
  private Generation generation = new Generation();

  @Getter
  @Setter
  public static class Profiles {
    private String catalog = "classpath:note-config/emr-profiles.json";
    private String defaultProfile = "credible";
  }

  @Getter
  @Setter
  public static class Generation {

    /** Timeout of a single provider call. */
    private Duration callTimeout = Duration.ofSeconds(60);

    /** Whether a failed compliance check triggers one stricter regeneration. */
    private boolean strictRetryEnabled = true;

    private int corePoolSize = 4;
    private int maxPoolSize = 8;
    private int queueCapacity = 50;
  }
}
