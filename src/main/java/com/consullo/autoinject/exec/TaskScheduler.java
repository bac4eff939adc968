package com.consullo.autoinject.exec;

import java.time.Clock;
import java.time.Duration;

/**
 * The single cooperative execution context that drives all automation logic.
 *
 * <p>Every task submitted here runs on one logical thread, one at a time. Components confined to
 * the scheduler (queue, registry, timer, injector, detectors) therefore need no locking: mutual
 * exclusion comes from the scheduler, and suspension points are modelled as delayed tasks.
 *
 * <p>The clock returned by {@link #clock()} is the only time source the core reads. Test
 * implementations advance it virtually.
 *
 * @since 1.0
 */
public interface TaskScheduler {

  /**
   * Runs the task as soon as possible on the execution context.
   *
   * @param task task to run
   */
  void execute(Runnable task);

  /**
   * Runs the task once after the delay.
   *
   * @param task task to run
   * @param delay delay, zero or positive
   * @return handle that cancels the task
   */
  Cancellable schedule(Runnable task, Duration delay);

  /**
   * Runs the task repeatedly, first after {@code initialDelay} and then every {@code period}.
   *
   * @param task task to run
   * @param initialDelay delay before the first run
   * @param period period between runs, positive
   * @return handle that stops further runs
   */
  Cancellable scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

  /**
   * Time source for all scheduling decisions.
   *
   * @return clock
   */
  Clock clock();
}
