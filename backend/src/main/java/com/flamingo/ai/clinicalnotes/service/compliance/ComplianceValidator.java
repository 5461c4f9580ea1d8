package com.flamingo.ai.clinicalnotes.service.compliance;

import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.domain.enums.ViolationKind;
import com.flamingo.ai.clinicalnotes.exception.NoteConfigurationException;
import com.flamingo.ai.clinicalnotes.service.compliance.model.ComplianceViolation;
import com.flamingo.ai.clinicalnotes.service.compliance.model.EmrProfile;
import com.flamingo.ai.clinicalnotes.service.compliance.model.TokenRule;
import com.flamingo.ai.clinicalnotes.service.compliance.model.ValidationResult;
import com.flamingo.ai.clinicalnotes.service.parsing.SectionParser;
import com.flamingo.ai.clinicalnotes.service.parsing.model.ParsedNote;
import com.flamingo.ai.clinicalnotes.service.parsing.model.Section;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Checks note text against an EMR profile and strips forbidden tokens.
 *
 * <p>Stateless; safe for concurrent use.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ComplianceValidator {

  private static final Pattern SPACE_RUNS = Pattern.compile("[ \\t]{2,}");
  private static final Pattern TRAILING_SPACES = Pattern.compile("(?m)[ \\t]+$");
  private static final int MAX_SANITIZE_PASSES = 5;

  private final SectionParser sectionParser;

  /**
   * Validates a complete note.
   *
   * <p>Missing required sections and forbidden tokens are errors. Length outside the profile's
   * bounds and the absence of any recognizable heading are warnings only.
   */
  public ValidationResult validate(String noteText, EmrProfile profile) {
    requireProfile(profile);
    String text = noteText == null ? "" : noteText;
    ParsedNote parsed = sectionParser.parse(text, profile);

    List<ComplianceViolation> violations = new ArrayList<>();
    if (profile.requiresCanonicalStructure()) {
      for (SectionType required : profile.canonicalStructureSections()) {
        if (!parsed.contains(required)) {
          violations.add(ComplianceViolation.missingSection(required));
        }
      }
    }
    violations.addAll(findTokenViolations(text, profile));

    List<String> warnings = new ArrayList<>();
    int length = text.strip().length();
    if (profile.minLength() > 0 && length < profile.minLength()) {
      warnings.add(
          "note length " + length + " is below the minimum of " + profile.minLength());
    }
    if (profile.maxLength() > 0 && length > profile.maxLength()) {
      warnings.add(
          "note length " + length + " exceeds the maximum of " + profile.maxLength());
    }
    boolean structured =
        parsed.sections().stream().map(Section::heading).anyMatch(heading -> !heading.isBlank());
    if (!structured) {
      warnings.add("note has no recognizable section headings");
    }

    ValidationResult result = ValidationResult.of(violations, warnings);
    log.debug(
        "Validated note against profile {}: valid={}, errors={}, warnings={}",
        profile.id(),
        result.isValid(),
        result.errors().size(),
        warnings.size());
    return result;
  }

  /**
   * Finds forbidden-token violations in a text fragment. Violations are not attributed to a
   * section; callers that validate per section attach the section type themselves.
   */
  public List<ComplianceViolation> findTokenViolations(String text, EmrProfile profile) {
    requireProfile(profile);
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    List<ComplianceViolation> violations = new ArrayList<>();
    for (TokenRule rule : profile.forbiddenTokenRules()) {
      int count = countMatches(rule.pattern(), text);
      if (count > 0) {
        violations.add(
            new ComplianceViolation(ViolationKind.FORBIDDEN_TOKEN, rule.name(), null, count));
      }
    }
    return violations;
  }

  /**
   * Replaces every forbidden token with its rule's plain replacement and collapses the whitespace
   * left behind. Deterministic and idempotent.
   */
  public String sanitize(String noteText, EmrProfile profile) {
    requireProfile(profile);
    if (noteText == null || noteText.isEmpty() || profile.forbiddenTokenRules().isEmpty()) {
      return noteText == null ? "" : noteText;
    }

    String text = noteText;
    for (int pass = 0; pass < MAX_SANITIZE_PASSES; pass++) {
      String next = sanitizeOnce(text, profile.forbiddenTokenRules());
      if (next.equals(text)) {
        break;
      }
      text = next;
    }
    return text;
  }

  private static String sanitizeOnce(String text, List<TokenRule> rules) {
    String result = text;
    for (TokenRule rule : rules) {
      Pattern pattern =
          rule.replacement().isEmpty() ? withLeadingSpace(rule.pattern()) : rule.pattern();
      result = pattern.matcher(result).replaceAll(Matcher.quoteReplacement(rule.replacement()));
    }
    result = SPACE_RUNS.matcher(result).replaceAll(" ");
    return TRAILING_SPACES.matcher(result).replaceAll("");
  }

  /** Widens a deletion pattern so that removing a token also removes the space before it. */
  private static Pattern withLeadingSpace(Pattern pattern) {
    return Pattern.compile("[ \\t]?(?:" + pattern.pattern() + ")", pattern.flags());
  }

  private static int countMatches(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  private static void requireProfile(EmrProfile profile) {
    if (profile == null || profile.id() == null || profile.id().isBlank()) {
      throw new NoteConfigurationException("An EMR profile with an id is required");
    }
  }
}
