package com.flamingo.ai.clinicalnotes.service.merge.model;

import com.flamingo.ai.clinicalnotes.domain.enums.ChangeAction;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;

/**
 * Ledger entry describing what happened to one section of the final note.
 *
 * @param sectionType section type
 * @param order position in the final note
 * @param action what was done to the section
 * @param originalContent content of the previous note
 * @param newContent content of the final note
 * @param reason human-readable explanation
 * @param confidence classification confidence of the content source
 * @param providerId provider that produced new content, null for preserved sections
 */
public record ChangeRecord(
    SectionType sectionType,
    int order,
    ChangeAction action,
    String originalContent,
    String newContent,
    String reason,
    double confidence,
    String providerId) {}
