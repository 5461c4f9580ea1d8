package com.flamingo.ai.clinicalnotes.domain.enums;

/** Typed failure of a generation provider call. */
public enum GatewayErrorKind {
  TIMEOUT,
  EMPTY_RESPONSE,
  PROVIDER_ERROR
}
