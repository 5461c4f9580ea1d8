package com.flamingo.ai.clinicalnotes.service.merge.model;

import com.flamingo.ai.clinicalnotes.domain.enums.MergeStrategy;
import com.flamingo.ai.clinicalnotes.domain.enums.SectionType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-section-type update choices for one merge. Types without an entry are preserved.
 *
 * <p>Immutable.
 */
public final class SelectionConfig {

  private final Map<SectionType, SectionSelection> selections;

  private SelectionConfig(Map<SectionType, SectionSelection> selections) {
    this.selections = Collections.unmodifiableMap(selections);
  }

  public static SelectionConfig of(Map<SectionType, SectionSelection> selections) {
    EnumMap<SectionType, SectionSelection> copy = new EnumMap<>(SectionType.class);
    if (selections != null) {
      selections.forEach(
          (type, selection) -> {
            if (type != null && selection != null) {
              copy.put(type, selection);
            }
          });
    }
    return new SelectionConfig(copy);
  }

  public static SelectionConfig none() {
    return of(Map.of());
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Selection for a type, defaulting to preserve when the type is not configured. */
  public SectionSelection forType(SectionType type) {
    return selections.getOrDefault(type, SectionSelection.preserve());
  }

  public boolean isSelected(SectionType type) {
    return forType(type).shouldUpdate();
  }

  /** Every type with an explicit entry, selected or not. */
  public Set<SectionType> configuredTypes() {
    return selections.isEmpty()
        ? EnumSet.noneOf(SectionType.class)
        : EnumSet.copyOf(selections.keySet());
  }

  /** Types whose entry has {@code shouldUpdate} set. */
  public Set<SectionType> selectedTypes() {
    Set<SectionType> selected = EnumSet.noneOf(SectionType.class);
    selections.forEach(
        (type, selection) -> {
          if (selection.shouldUpdate()) {
            selected.add(type);
          }
        });
    return selected;
  }

  public boolean allPreserved() {
    return selectedTypes().isEmpty();
  }

  public Map<SectionType, SectionSelection> asMap() {
    return selections;
  }

  @Override
  public String toString() {
    return "SelectionConfig" + selections;
  }

  /** Fluent builder for tests and callers that assemble selections in code. */
  public static final class Builder {

    private final Map<SectionType, SectionSelection> selections =
        new EnumMap<>(SectionType.class);

    private Builder() {}

    public Builder update(SectionType type, MergeStrategy strategy) {
      selections.put(type, SectionSelection.update(strategy));
      return this;
    }

    public Builder preserve(SectionType type) {
      selections.put(type, SectionSelection.preserve());
      return this;
    }

    public SelectionConfig build() {
      return of(selections);
    }
  }
}
