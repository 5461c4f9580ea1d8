package com.flamingo.ai.clinicalnotes.service.merge.model;

import com.flamingo.ai.clinicalnotes.service.compliance.model.ValidationResult;
import com.flamingo.ai.clinicalnotes.service.parsing.model.Section;
import java.util.List;

/**
 * Result of a selective update.
 *
 * @param finalText rendered final note
 * @param sections final sections, same type sequence as the previous note
 * @param changeLedger one record per final section, in order
 * @param validation compliance result of {@code finalText}
 * @param metadata provider, retry and sanitization details
 */
public record MergedNote(
    String finalText,
    List<Section> sections,
    List<ChangeRecord> changeLedger,
    ValidationResult validation,
    MergeMetadata metadata) {

  public MergedNote {
    sections = List.copyOf(sections);
    changeLedger = List.copyOf(changeLedger);
  }
}
