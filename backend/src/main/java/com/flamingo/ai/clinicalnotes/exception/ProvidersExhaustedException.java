package com.flamingo.ai.clinicalnotes.exception;

/**
 * Exception thrown when both the primary and the fallback provider failed on the initial
 * generation. No note is produced.
 */
public class ProvidersExhaustedException extends RuntimeException {

  private final GatewayException primaryError;
  private final GatewayException secondaryError;
  private final String userMessage;

  public ProvidersExhaustedException(
      GatewayException primaryError, GatewayException secondaryError) {
    super(
        "All generation providers failed: primary '"
            + primaryError.getProviderId()
            + "' ("
            + primaryError.getKind()
            + "), fallback '"
            + secondaryError.getProviderId()
            + "' ("
            + secondaryError.getKind()
            + ")",
        secondaryError);
    addSuppressed(primaryError);
    this.primaryError = primaryError;
    this.secondaryError = secondaryError;
    this.userMessage = "Note generation is temporarily unavailable. Please try again later.";
  }

  public GatewayException getPrimaryError() {
    return primaryError;
  }

  public GatewayException getSecondaryError() {
    return secondaryError;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
