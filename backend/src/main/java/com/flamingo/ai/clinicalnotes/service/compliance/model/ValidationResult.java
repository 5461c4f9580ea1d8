package com.flamingo.ai.clinicalnotes.service.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Outcome of validating a note against an EMR profile.
 *
 * @param isValid true when there are no errors
 * @param errors hard failures, one per violation
 * @param warnings soft findings that do not affect validity
 * @param violations structured form of {@code errors}
 */
public record ValidationResult(
    @JsonProperty("isValid") boolean isValid,
    List<String> errors,
    List<String> warnings,
    List<ComplianceViolation> violations) {

  public ValidationResult {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
    violations = List.copyOf(violations);
  }

  public static ValidationResult of(List<ComplianceViolation> violations, List<String> warnings) {
    List<String> errors = violations.stream().map(ComplianceViolation::describe).toList();
    return new ValidationResult(violations.isEmpty(), errors, warnings, violations);
  }
}
