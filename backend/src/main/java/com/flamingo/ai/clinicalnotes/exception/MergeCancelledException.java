package com.flamingo.ai.clinicalnotes.exception;

import com.flamingo.ai.clinicalnotes.domain.enums.MergeState;

/** Exception thrown when a merge is cancelled by its caller. */
public class MergeCancelledException extends RuntimeException {

  private final MergeState state;

  public MergeCancelledException(MergeState state) {
    super("Merge cancelled during " + state);
    this.state = state;
  }

  public MergeState getState() {
    return state;
  }
}
