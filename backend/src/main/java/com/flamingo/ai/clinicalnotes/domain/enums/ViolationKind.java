package com.flamingo.ai.clinicalnotes.domain.enums;

/** Hard compliance rule classes reported by the validator. */
public enum ViolationKind {
  FORBIDDEN_TOKEN,
  MISSING_SECTION
}
