package com.flamingo.ai.clinicalnotes.service.compliance.model;

import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.service.parsing.AliasTable;
import java.util.List;
import lombok.Builder;

/**
 * Static description of what a target EMR accepts.
 *
 * @param id stable profile identifier
 * @param displayName human-readable name
 * @param aliasTable heading table used to parse notes for this EMR
 * @param forbiddenTokenRules token rules whose matches are compliance errors
 * @param requiresCanonicalStructure whether {@code canonicalStructureSections} must all be present
 * @param canonicalStructureSections section types a compliant note must contain
 * @param minLength soft lower bound on note length in characters
 * @param maxLength soft upper bound on note length in characters
 */
@Builder
public record EmrProfile(
    String id,
    String displayName,
    AliasTable aliasTable,
    List<TokenRule> forbiddenTokenRules,
    boolean requiresCanonicalStructure,
    List<SectionType> canonicalStructureSections,
    int minLength,
    int maxLength) {

  public EmrProfile {
    forbiddenTokenRules =
        forbiddenTokenRules == null ? List.of() : List.copyOf(forbiddenTokenRules);
    canonicalStructureSections =
        canonicalStructureSections == null ? List.of() : List.copyOf(canonicalStructureSections);
  }

  /** Names of the forbidden-token rules, in declaration order. */
  public List<String> ruleNames() {
    return forbiddenTokenRules.stream().map(TokenRule::name).toList();
  }
}
