package com.flamingo.ai.clinicalnotes.domain.enums;

/** How regenerated content is combined with the previous content of a selected section. */
public enum MergeStrategy {
  /** Regenerated content overwrites the previous content. */
  REPLACE,

  /** Regenerated content is added after the previous content. */
  APPEND,

  /** Line union: previous lines first, then regenerated lines not already present. */
  MERGE
}
