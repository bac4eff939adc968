package com.consullo.autoinject.testsupport;

import com.consullo.autoinject.exec.Cancellable;
import com.consullo.autoinject.exec.TaskScheduler;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Virtual-time {@link TaskScheduler}. Nothing runs until the test calls {@link #runPending()} or
 * {@link #advance(Duration)}; tasks run in due-time order, ties in submission order.
 */
public final class ManualTaskScheduler implements TaskScheduler {

  /** 2026-01-15 10:00:00 UTC. */
  public static final Instant DEFAULT_START = Instant.parse("2026-01-15T10:00:00Z");

  private final MutableClock clock;
  private final PriorityQueue<Entry> tasks = new PriorityQueue<>(
      Comparator.comparing((Entry e) -> e.due).thenComparingLong(e -> e.seq));
  private long nextSeq;

  public ManualTaskScheduler() {
    this(new MutableClock(DEFAULT_START, ZoneOffset.UTC));
  }

  public ManualTaskScheduler(final MutableClock clock) {
    this.clock = clock;
  }

  @Override
  public void execute(final Runnable task) {
    add(task, clock.instant(), null);
  }

  @Override
  public Cancellable schedule(final Runnable task, final Duration delay) {
    return add(task, clock.instant().plus(delay), null);
  }

  @Override
  public Cancellable scheduleAtFixedRate(final Runnable task, final Duration initialDelay, final Duration period) {
    return add(task, clock.instant().plus(initialDelay), period);
  }

  @Override
  public Clock clock() {
    return clock;
  }

  public MutableClock mutableClock() {
    return clock;
  }

  public Instant now() {
    return clock.instant();
  }

  /**
   * Runs every task due at the current time, including tasks they schedule for now.
   */
  public void runPending() {
    advance(Duration.ZERO);
  }

  /**
   * Moves time forward, running every task that becomes due on the way at its own due time.
   *
   * @param duration time to advance
   */
  public void advance(final Duration duration) {
    final Instant target = clock.instant().plus(duration);
    while (true) {
      final Entry next = tasks.peek();
      if (next == null || next.due.isAfter(target)) {
        break;
      }
      tasks.poll();
      if (next.cancelled) {
        continue;
      }
      if (next.due.isAfter(clock.instant())) {
        clock.set(next.due);
      }
      if (next.period != null) {
        next.due = next.due.plus(next.period);
        next.seq = nextSeq++;
        tasks.add(next);
      }
      next.task.run();
    }
    clock.set(target);
  }

  public int pendingCount() {
    return (int) tasks.stream().filter(e -> !e.cancelled).count();
  }

  private Entry add(final Runnable task, final Instant due, final Duration period) {
    final Entry e = new Entry(task, due, period, nextSeq++);
    tasks.add(e);
    return e;
  }

  private static final class Entry implements Cancellable {

    private final Runnable task;
    private final Duration period;
    private Instant due;
    private long seq;
    private boolean cancelled;

    private Entry(final Runnable task, final Instant due, final Duration period, final long seq) {
      this.task = task;
      this.due = due;
      this.period = period;
      this.seq = seq;
    }

    @Override
    public void cancel() {
      cancelled = true;
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }
  }
}
