package com.flamingo.ai.clinicalnotes.service.parsing.model;

import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of parsing a clinical note: its sections in document order plus parse metadata.
 *
 * <p>Produced fresh by every parse call and never mutated afterwards.
 *
 * @param sections sections in document order
 * @param parseMetadata confidence summary and warnings
 */
public record ParsedNote(List<Section> sections, ParseMetadata parseMetadata) {

  public ParsedNote {
    sections = List.copyOf(sections);
  }

  /** Section types in document order, without duplicates. */
  public Set<SectionType> sectionTypes() {
    Set<SectionType> types = new LinkedHashSet<>();
    for (Section section : sections) {
      types.add(section.type());
    }
    return types;
  }

  /** Section types in document order, including duplicates. */
  public List<SectionType> typeSequence() {
    return sections.stream().map(Section::type).toList();
  }

  public boolean contains(SectionType type) {
    return sections.stream().anyMatch(section -> section.type() == type);
  }
}
