package com.ltlplan.util;

import java.util.concurrent.CancellationException;

public final class Cancellation {
  private Cancellation() {}

  /** Throws if the current thread was interrupted. Called once per search or construction layer. */
  public static void check(String phase) {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Interrupted during " + phase);
    }
  }
}
