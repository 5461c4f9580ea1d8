package com.flamingo.ai.clinicalnotes.service.parsing.model;

import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;

/**
 * One typed section of a clinical note.
 *
 * @param type canonical section kind
 * @param title display title (the canonical title for resolved types, the heading text otherwise)
 * @param content body text without the heading line
 * @param order zero-based position in the note
 * @param confidence classification confidence in {@code [0, 1]}
 * @param metadata heading and body facts
 */
public record Section(
    SectionType type,
    String title,
    String content,
    int order,
    double confidence,
    SectionMetadata metadata) {

  /** Heading line to write when the section is rendered back to text. */
  public String heading() {
    return metadata == null ? "" : metadata.originalHeading();
  }
}
