package com.flamingo.ai.clinicalnotes.service.compliance.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import com.flamingo.ai.clinicalnotes.service.compliance.model.TokenRule;
import com.flamingo.ai.clinicalnotes.service.parsing.AliasTable;
import com.flamingo.ai.clinicalnotes.service.parsing.AliasTableDefinition;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Loads EMR profiles and their alias tables from JSON resources.
 *
 * <p>Any inconsistency in the catalog (unknown alias table or token rule, invalid regex, missing
 * ids) fails start-up.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProfileCatalogLoader {

  private final ObjectMapper objectMapper;
  private final ResourceLoader resourceLoader;

  /**
   * Loads the catalog at the given location.
   *
   * @param catalogLocation resource location, {@code classpath:} is assumed when no prefix is given
   * @return profiles in catalog order
   */
  public List<EmrProfile> load(String catalogLocation) {
    ProfileCatalogDefinition catalog = read(catalogLocation, ProfileCatalogDefinition.class);
    if (catalog.profiles() == null || catalog.profiles().isEmpty()) {
      throw new IllegalStateException(
          "EMR profile catalog " + catalogLocation + " has no profiles");
    }

    Map<String, AliasTable> tables = new HashMap<>();
    for (String location : nullSafe(catalog.aliasTables())) {
      AliasTable table = AliasTable.fromDefinition(read(location, AliasTableDefinition.class));
      tables.put(table.id(), table);
      log.debug("Loaded alias table '{}' from {}", table.id(), location);
    }

    Map<String, TokenRule> rules = new HashMap<>();
    if (catalog.tokenRules() != null) {
      catalog.tokenRules().forEach((name, rule) -> rules.put(name, toTokenRule(name, rule)));
    }

    List<EmrProfile> profiles = new ArrayList<>();
    for (ProfileCatalogDefinition.EmrProfileDefinition definition : catalog.profiles()) {
      profiles.add(toProfile(definition, tables, rules));
    }
    log.info("Loaded {} EMR profiles from {}", profiles.size(), catalogLocation);
    return profiles;
  }

  private EmrProfile toProfile(
      ProfileCatalogDefinition.EmrProfileDefinition definition,
      Map<String, AliasTable> tables,
      Map<String, TokenRule> rules) {
    if (definition.id() == null || definition.id().isBlank()) {
      throw new IllegalStateException("EMR profile definition without id");
    }
    AliasTable table = tables.get(definition.aliasTable());
    if (table == null) {
      throw new IllegalStateException(
          "EMR profile '"
              + definition.id()
              + "' references unknown alias table '"
              + definition.aliasTable()
              + "'");
    }

    List<TokenRule> profileRules = new ArrayList<>();
    for (String ruleName : nullSafe(definition.forbiddenTokens())) {
      TokenRule rule = rules.get(ruleName);
      if (rule == null) {
        throw new IllegalStateException(
            "EMR profile '"
                + definition.id()
                + "' references unknown token rule '"
                + ruleName
                + "'");
      }
      profileRules.add(rule);
    }

    return EmrProfile.builder()
        .id(definition.id())
        .displayName(
            definition.displayName() == null ? definition.id() : definition.displayName())
        .aliasTable(table)
        .forbiddenTokenRules(profileRules)
        .requiresCanonicalStructure(definition.requiresCanonicalStructure())
        .canonicalStructureSections(definition.canonicalStructureSections())
        .minLength(definition.minLength() == null ? 0 : definition.minLength())
        .maxLength(definition.maxLength() == null ? 0 : definition.maxLength())
        .build();
  }

  private static TokenRule toTokenRule(
      String name, ProfileCatalogDefinition.TokenRuleDefinition definition) {
    if (definition == null || definition.pattern() == null || definition.pattern().isEmpty()) {
      throw new IllegalStateException("Token rule '" + name + "' has no pattern");
    }
    try {
      return new TokenRule(name, Pattern.compile(definition.pattern()), definition.replacement());
    } catch (PatternSyntaxException e) {
      throw new IllegalStateException("Token rule '" + name + "' has an invalid pattern", e);
    }
  }

  private <T> T read(String location, Class<T> type) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new IllegalStateException("Note configuration resource not found: " + location);
    }
    try (InputStream input = resource.getInputStream()) {
      return objectMapper.readValue(input, type);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read note configuration " + location, e);
    }
  }

  private static List<String> nullSafe(List<String> values) {
    return values == null ? List.of() : values;
  }
}
