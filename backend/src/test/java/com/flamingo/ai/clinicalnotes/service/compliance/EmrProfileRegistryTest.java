package com.flamingo.ai.clinicalnotes.service.compliance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.clinicalnotes.exception.ProfileNotFoundException;
import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import com.flamingo.ai.clinicalnotes.support.TestProfiles;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EmrProfileRegistry Tests")
class EmrProfileRegistryTest {

  private final EmrProfile epic = TestProfiles.epic();
  private final EmrProfile credible = TestProfiles.credible();

  @Test
  @DisplayName("should return profiles by id in catalog order")
  void shouldReturnProfiles() {
    EmrProfileRegistry registry = new EmrProfileRegistry(List.of(epic, credible), "credible");

    assertThat(registry.get("epic")).isSameAs(epic);
    assertThat(registry.all()).containsExactly(epic, credible);
    assertThat(registry.find("cerner")).isEmpty();
    assertThat(registry.find(null)).isEmpty();
  }

  @Test
  @DisplayName("should fall back to the default profile when no id is given")
  void shouldReturnDefault_whenIdBlank() {
    EmrProfileRegistry registry = new EmrProfileRegistry(List.of(epic, credible), "credible");

    assertThat(registry.getOrDefault(null)).isSameAs(credible);
    assertThat(registry.getOrDefault(" ")).isSameAs(credible);
    assertThat(registry.getOrDefault("epic")).isSameAs(epic);
  }

  @Test
  @DisplayName("should throw ProfileNotFoundException for unknown ids")
  void shouldThrow_whenProfileUnknown() {
    EmrProfileRegistry registry = new EmrProfileRegistry(List.of(epic, credible), "credible");

    assertThatThrownBy(() -> registry.getOrDefault("cerner"))
        .isInstanceOf(ProfileNotFoundException.class)
        .satisfies(
            e -> assertThat(((ProfileNotFoundException) e).getProfileId()).isEqualTo("cerner"));
  }

  @Test
  @DisplayName("should reject duplicate profile ids")
  void shouldReject_whenDuplicateIds() {
    assertThatThrownBy(() -> new EmrProfileRegistry(List.of(epic, epic), "epic"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate");
  }

  @Test
  @DisplayName("should reject a default profile id missing from the catalog")
  void shouldReject_whenDefaultUnknown() {
    assertThatThrownBy(() -> new EmrProfileRegistry(List.of(epic), "credible"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Default EMR profile 'credible'");
  }
}
