package com.flamingo.ai.clinicalnotes.domain.enums;

/** Which pass of a selective update a generation attempt belonged to. */
public enum GenerationPhase {
  INITIAL,
  STRICT_RETRY
}
