package com.flamingo.ai.clinicalnotes.domain.enums;

/** Resolution tier of a section heading, with the confidence each tier assigns. */
public enum AliasTier {
  CANONICAL(1.0),
  ALIAS(0.8),
  KEYWORD(0.5),
  UNRESOLVED(0.3);

  private final double confidence;

  AliasTier(double confidence) {
    this.confidence = confidence;
  }

  public double getConfidence() {
    return confidence;
  }
}
