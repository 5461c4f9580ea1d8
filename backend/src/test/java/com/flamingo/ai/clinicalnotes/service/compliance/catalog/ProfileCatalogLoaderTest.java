package com.flamingo.ai.clinicalnotes.service.compliance.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

@DisplayName("ProfileCatalogLoader Tests")
class ProfileCatalogLoaderTest {

  private ProfileCatalogLoader loader;

  @BeforeEach
  void setUp() {
    loader = new ProfileCatalogLoader(new ObjectMapper(), new DefaultResourceLoader());
  }

  @Test
  @DisplayName("should load the bundled catalog with its three profiles")
  void shouldLoadBundledCatalog() {
    List<EmrProfile> profiles = loader.load("classpath:note-config/emr-profiles.json");

    assertThat(profiles)
        .extracting(EmrProfile::id)
        .containsExactly("epic", "credible", "credible-transfer");

    EmrProfile epic = profiles.get(0);
    assertThat(epic.forbiddenTokenRules()).isEmpty();
    assertThat(epic.requiresCanonicalStructure()).isFalse();

    EmrProfile credible = profiles.get(1);
    assertThat(credible.ruleNames())
        .containsExactly("smart-phrase", "smart-list", "wildcard-blank", "dot-phrase");
    assertThat(credible.aliasTable().id()).isEqualTo("behavioral-health");

    EmrProfile transfer = profiles.get(2);
    assertThat(transfer.requiresCanonicalStructure()).isTrue();
    assertThat(transfer.canonicalStructureSections())
        .containsExactly(
            SectionType.HPI, SectionType.PSYCHIATRIC_EXAM, SectionType.ASSESSMENT_AND_PLAN);
    assertThat(transfer.minLength()).isEqualTo(200);
  }

  @Test
  @DisplayName("should share one alias table instance between profiles")
  void shouldShareAliasTable() {
    List<EmrProfile> profiles = loader.load("classpath:note-config/emr-profiles.json");

    assertThat(profiles.get(0).aliasTable()).isSameAs(profiles.get(1).aliasTable());
  }

  @Test
  @DisplayName("should default optional profile fields")
  void shouldDefaultOptionalFields_whenOmitted() {
    EmrProfile profile = loader.load("classpath:catalog-fixtures/minimal.json").get(0);

    assertThat(profile.displayName()).isEqualTo("plain");
    assertThat(profile.forbiddenTokenRules()).isEmpty();
    assertThat(profile.canonicalStructureSections()).isEmpty();
    assertThat(profile.minLength()).isZero();
  }

  @Test
  @DisplayName("should fail when a profile references an unknown alias table")
  void shouldFail_whenAliasTableUnknown() {
    assertThatThrownBy(() -> loader.load("classpath:catalog-fixtures/unknown-alias-table.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("unknown alias table 'primary-care'");
  }

  @Test
  @DisplayName("should fail when a profile references an unknown token rule")
  void shouldFail_whenTokenRuleUnknown() {
    assertThatThrownBy(() -> loader.load("classpath:catalog-fixtures/unknown-token-rule.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("unknown token rule 'smart-list'");
  }

  @Test
  @DisplayName("should fail when a token rule pattern does not compile")
  void shouldFail_whenPatternInvalid() {
    assertThatThrownBy(() -> loader.load("classpath:catalog-fixtures/invalid-pattern.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("invalid pattern");
  }

  @Test
  @DisplayName("should fail when the catalog has no profiles")
  void shouldFail_whenNoProfiles() {
    assertThatThrownBy(() -> loader.load("classpath:catalog-fixtures/no-profiles.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("has no profiles");
  }

  @Test
  @DisplayName("should fail when the catalog resource is missing")
  void shouldFail_whenResourceMissing() {
    assertThatThrownBy(() -> loader.load("classpath:catalog-fixtures/missing.json"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not found");
  }
}
