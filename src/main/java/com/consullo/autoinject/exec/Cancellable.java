package com.consullo.autoinject.exec;

/**
 * Handle to a pending task on a {@link TaskScheduler}.
 *
 * @since 1.0
 */
public interface Cancellable {

  /** Handle for work that is already done or was never scheduled. */
  Cancellable NONE = new Cancellable() {
    @Override
    public void cancel() {
    }

    @Override
    public boolean isCancelled() {
      return true;
    }
  };

  /**
   * Cancels the task if it has not started yet. Calling this more than once is harmless.
   */
  void cancel();

  /**
   * Returns true once {@link #cancel()} has been called.
   *
   * @return cancellation state
   */
  boolean isCancelled();
}
