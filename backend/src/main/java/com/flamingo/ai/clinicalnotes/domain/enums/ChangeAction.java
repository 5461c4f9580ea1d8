package com.flamingo.ai.clinicalnotes.domain.enums;

/** Action recorded in the change ledger for one section of a merged note. */
public enum ChangeAction {
  UPDATED,
  PRESERVED,
  MERGED,
  /** Reserved for callers that add sections outside the merge engine; the splice never adds. */
  ADDED
}
