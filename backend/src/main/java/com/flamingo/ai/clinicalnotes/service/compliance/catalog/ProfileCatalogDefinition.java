package com.flamingo.ai.clinicalnotes.service.compliance.catalog;

import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import java.util.List;
import java.util.Map;

/**
 * JSON shape of the EMR profile catalog.
 *
 * @param aliasTables classpath locations of the alias tables profiles may reference
 * @param tokenRules named forbidden-token rules shared between profiles
 * @param profiles profile definitions
 */
public record ProfileCatalogDefinition(
    List<String> aliasTables,
    Map<String, TokenRuleDefinition> tokenRules,
    List<EmrProfileDefinition> profiles) {

  /**
   * A forbidden-token rule.
   *
   * @param pattern Java regular expression
   * @param replacement plain text written in place of each match, empty to delete it
   */
  public record TokenRuleDefinition(String pattern, String replacement) {}

  /**
   * One EMR profile.
   *
   * @param id stable profile id
   * @param displayName human-readable name
   * @param aliasTable id of the alias table used to parse notes
   * @param forbiddenTokens names of {@code tokenRules} entries enforced by this profile
   * @param requiresCanonicalStructure whether the required sections must all be present
   * @param canonicalStructureSections required section types
   * @param minLength soft minimum note length, null or 0 for none
   * @param maxLength soft maximum note length, null or 0 for none
   */
  public record EmrProfileDefinition(
      String id,
      String displayName,
      String aliasTable,
      List<String> forbiddenTokens,
      boolean requiresCanonicalStructure,
      List<SectionType> canonicalStructureSections,
      Integer minLength,
      Integer maxLength) {}
}
