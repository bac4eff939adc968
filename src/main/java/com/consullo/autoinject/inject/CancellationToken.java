package com.consullo.autoinject.inject;

/**
 * Checked by an injection between steps.
 *
 * @since 1.0
 */
public final class CancellationToken {

  private boolean cancelled;

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }
}
