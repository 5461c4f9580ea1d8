package com.flamingo.ai.clinicalnotes.domain.enums;

/** States of one selective update, in the order they are normally visited. */
public enum MergeState {
  INIT,
  REQUEST_BUILT,
  GENERATING,
  REPARSING,
  SPLICING,
  VALIDATING,
  RETRY_GENERATING,
  SANITIZING,
  DONE,
  FAILED
}
