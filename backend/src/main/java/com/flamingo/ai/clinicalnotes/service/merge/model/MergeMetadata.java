package com.flamingo.ai.clinicalnotes.service.merge.model;

import com.flamingo.ai.clinicalnotes.domain.enums.MergeState;
import java.util.List;

/**
 * How a merged note was produced.
 *
 * @param providerId provider whose text was spliced, null when nothing was generated
 * @param fallbackUsed whether that provider was the fallback
 * @param retried whether a strict retry was attempted
 * @param sanitized whether emergency sanitization was applied
 * @param attempts every provider call, in order
 * @param stateTrace states visited, in order
 * @param warnings non-fatal findings (omitted sections, degraded retry, discarded sections)
 */
public record MergeMetadata(
    String providerId,
    boolean fallbackUsed,
    boolean retried,
    boolean sanitized,
    List<GenerationAttempt> attempts,
    List<MergeState> stateTrace,
    List<String> warnings) {

  public MergeMetadata {
    attempts = List.copyOf(attempts);
    stateTrace = List.copyOf(stateTrace);
    warnings = List.copyOf(warnings);
  }
}
