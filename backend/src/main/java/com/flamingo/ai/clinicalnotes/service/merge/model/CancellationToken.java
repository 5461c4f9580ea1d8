package com.flamingo.ai.clinicalnotes.service.merge.model;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation flag checked by the merge engine between steps. Thread-safe. */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** A fresh token that has not been cancelled. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
