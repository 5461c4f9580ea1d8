package com.flamingo.ai.clinicalnotes.exception;

import com.flamingo.ai.clinicalnotes.domain.enums.GatewayErrorKind;

/** Exception thrown when a generation provider call fails. Retryable against another provider. */
public class GatewayException extends RuntimeException {

  private final GatewayErrorKind kind;
  private final String providerId;
  private final String userMessage;

  public GatewayException(GatewayErrorKind kind, String providerId, String message) {
    super(message);
    this.kind = kind;
    this.providerId = providerId;
    this.userMessage = userMessageFor(kind);
  }

  public GatewayException(
      GatewayErrorKind kind, String providerId, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.providerId = providerId;
    this.userMessage = userMessageFor(kind);
  }

  public GatewayErrorKind getKind() {
    return kind;
  }

  public String getProviderId() {
    return providerId;
  }

  public String getUserMessage() {
    return userMessage;
  }

  private static String userMessageFor(GatewayErrorKind kind) {
    return switch (kind) {
      case TIMEOUT -> "AI service took too long to respond. Please try again later.";
      case EMPTY_RESPONSE -> "AI service returned an empty note. Please try again.";
      case PROVIDER_ERROR -> "AI service is temporarily unavailable. Please try again later.";
    };
  }
}
