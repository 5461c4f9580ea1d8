package com.flamingo.ai.clinicalnotes.service.generation;

/**
 * Primary and fallback providers used by one merge.
 *
 * @param primary provider tried first
 * @param fallback provider tried once when the primary fails
 */
public record GatewayPair(GenerationGateway primary, GenerationGateway fallback) {}
