package com.flamingo.ai.clinicalnotes.service.merge.model;

import com.flamingo.ai.clinicalnotes.domain.enums.GatewayErrorKind;
import com.flamingo.ai.clinicalnotes.domain.enums.GenerationPhase;

/**
 * One provider call made during a merge.
 *
 * @param phase initial generation or strict retry
 * @param providerId provider called
 * @param fallback whether the provider was the fallback
 * @param succeeded whether text was returned
 * @param errorKind failure kind, null on success
 * @param errorMessage failure message, null on success
 */
public record GenerationAttempt(
    GenerationPhase phase,
    String providerId,
    boolean fallback,
    boolean succeeded,
    GatewayErrorKind errorKind,
    String errorMessage) {}
