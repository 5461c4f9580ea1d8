package com.flamingo.ai.clinicalnotes.service.compliance.model;

import java.util.regex.Pattern;

/**
 * A forbidden-token rule of an EMR profile.
 *
 * @param name rule name reported in violations (e.g. {@code smart-phrase})
 * @param pattern compiled pattern matching the forbidden token
 * @param replacement plain text substituted by sanitization, possibly empty
 */
public record TokenRule(String name, Pattern pattern, String replacement) {

  public TokenRule {
    replacement = replacement == null ? "" : replacement;
  }
}
