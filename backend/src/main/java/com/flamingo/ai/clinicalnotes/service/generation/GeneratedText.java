package com.flamingo.ai.clinicalnotes.service.generation;

/**
 * Raw text returned by a provider.
 *
 * @param text candidate note text, never blank
 * @param providerId provider that produced it
 */
public record GeneratedText(String text, String providerId) {}
