package com.flamingo.ai.clinicalnotes.service.merge.model;

import com.flamingo.ai.clinicalnotes.domain.enums.MergeStrategy;

/**
 * Caller's choice for one section type.
 *
 * @param shouldUpdate whether the section may take regenerated content
 * @param mergeStrategy how regenerated content is combined with the previous content
 */
public record SectionSelection(boolean shouldUpdate, MergeStrategy mergeStrategy) {

  public SectionSelection {
    mergeStrategy = mergeStrategy == null ? MergeStrategy.REPLACE : mergeStrategy;
  }

  public static SectionSelection update(MergeStrategy strategy) {
    return new SectionSelection(true, strategy);
  }

  public static SectionSelection preserve() {
    return new SectionSelection(false, MergeStrategy.REPLACE);
  }
}
