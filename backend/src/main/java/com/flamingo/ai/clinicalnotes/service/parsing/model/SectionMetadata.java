package com.flamingo.ai.clinicalnotes.service.parsing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Descriptive facts about a parsed section.
 *
 * @param originalHeading heading line exactly as it appeared in the note (trimmed), empty for
 *     synthesized or preamble sections
 * @param wordCount number of whitespace-separated words in the section body
 * @param standardized whether the heading resolved with confidence of at least 0.8
 * @param hasPlaceholderSyntax whether the body contains vendor placeholder tokens
 */
public record SectionMetadata(
    String originalHeading,
    int wordCount,
    @JsonProperty("isStandardized") boolean standardized,
    boolean hasPlaceholderSyntax) {}
