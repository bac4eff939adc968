package com.consullo.autoinject.exec;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TaskScheduler} backed by a single daemon thread.
 *
 * <p>Tasks that throw are logged and dropped; the loop thread keeps running.
 *
 * @since 1.0
 */
public final class SingleThreadTaskScheduler implements TaskScheduler, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SingleThreadTaskScheduler.class);

  private final ScheduledExecutorService executor;
  private final Clock clock;

  /**
   * Creates a scheduler using the system clock in the default time zone.
   */
  public SingleThreadTaskScheduler() {
    this(Clock.systemDefaultZone());
  }

  /**
   * Creates a scheduler using the supplied clock.
   *
   * @param clock time source
   */
  public SingleThreadTaskScheduler(final Clock clock) {
    Validate.notNull(clock, "clock must not be null");
    this.clock = clock;
    this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
      final Thread t = new Thread(r, "AutomationLoop");
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public void execute(final Runnable task) {
    Validate.notNull(task, "task must not be null");
    this.executor.execute(guard(task));
  }

  @Override
  public Cancellable schedule(final Runnable task, final Duration delay) {
    Validate.notNull(task, "task must not be null");
    Validate.isTrue(!delay.isNegative(), "delay must not be negative");
    final ScheduledFuture<?> future = this.executor.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS);
    return new FutureHandle(future);
  }

  @Override
  public Cancellable scheduleAtFixedRate(final Runnable task, final Duration initialDelay, final Duration period) {
    Validate.notNull(task, "task must not be null");
    Validate.isTrue(!initialDelay.isNegative(), "initialDelay must not be negative");
    Validate.isTrue(!period.isNegative() && !period.isZero(), "period must be positive");
    final ScheduledFuture<?> future = this.executor.scheduleAtFixedRate(
        guard(task), initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS);
    return new FutureHandle(future);
  }

  @Override
  public Clock clock() {
    return this.clock;
  }

  @Override
  public void close() {
    this.executor.shutdownNow();
  }

  private static Runnable guard(final Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (final RuntimeException e) {
        LOGGER.error("Automation task failed: {}", e.getMessage(), e);
      }
    };
  }

  private static final class FutureHandle implements Cancellable {

    private final ScheduledFuture<?> future;

    private FutureHandle(final ScheduledFuture<?> future) {
      this.future = future;
    }

    @Override
    public void cancel() {
      this.future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return this.future.isCancelled();
    }
  }
}
