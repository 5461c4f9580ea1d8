package com.flamingo.ai.clinicalnotes.service.generation;

import com.flamingo.ai.clinicalnotes.exception.GatewayException;

/** A text-generation provider. Implementations must be safe for concurrent use. */
public interface GenerationGateway {

  /** Stable identifier reported on results, ledgers and errors. */
  String providerId();

  /**
   * Generates a candidate note.
   *
   * @throws GatewayException on timeout, empty response or any provider failure
   */
  GeneratedText generate(GenerationRequest request);
}
