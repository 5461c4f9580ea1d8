package com.flamingo.ai.clinicalnotes.service.compliance.model;

import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import com.flamingo.ai.clinicalnotes.domain.enums.ViolationKind;

/**
 * A single hard compliance failure.
 *
 * @param kind forbidden token or missing section
 * @param ruleName token rule name, or {@code required-section} for structural failures
 * @param sectionType section the violation belongs to, or {@code null} when not attributable
 * @param matchCount number of token matches (1 for a missing section)
 */
public record ComplianceViolation(
    ViolationKind kind, String ruleName, SectionType sectionType, int matchCount) {

  /** Rule name used for structural violations. */
  public static final String REQUIRED_SECTION_RULE = "required-section";

  public static ComplianceViolation missingSection(SectionType type) {
    return new ComplianceViolation(ViolationKind.MISSING_SECTION, REQUIRED_SECTION_RULE, type, 1);
  }

  public ComplianceViolation withSection(SectionType type) {
    return new ComplianceViolation(kind, ruleName, type, matchCount);
  }

  /** Human-readable description, used as a validation error and in retry prompts. */
  public String describe() {
    return switch (kind) {
      case MISSING_SECTION -> "missing required section " + sectionType.getDisplayTitle();
      case FORBIDDEN_TOKEN ->
          "forbidden token '"
              + ruleName
              + "' found "
              + matchCount
              + (matchCount == 1 ? " time" : " times")
              + (sectionType == null ? "" : " in " + sectionType.getDisplayTitle());
    };
  }
}
