package com.consullo.autoinject.event;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User-facing action log.
 *
 * <p>Each entry is mirrored to SLF4J and published to {@link AutomationEvents}. The most recent
 * entries are retained for display; older ones are dropped.
 *
 * @since 1.0
 */
public final class ActionLog {

  private static final Logger LOGGER = LoggerFactory.getLogger(ActionLog.class);

  /** Entries retained in memory. */
  public static final int DEFAULT_CAPACITY = 500;

  private final Clock clock;
  private final AutomationEvents events;
  private final int capacity;
  private final Deque<ActionEvent> recent = new ArrayDeque<>();

  public ActionLog(final Clock clock, final AutomationEvents events) {
    this(clock, events, DEFAULT_CAPACITY);
  }

  public ActionLog(final Clock clock, final AutomationEvents events, final int capacity) {
    Validate.notNull(clock, "clock must not be null");
    Validate.notNull(events, "events must not be null");
    Validate.isTrue(capacity > 0, "capacity must be positive");
    this.clock = clock;
    this.events = events;
    this.capacity = capacity;
  }

  public void info(final String message) {
    log(message, ActionLevel.INFO);
  }

  public void success(final String message) {
    log(message, ActionLevel.SUCCESS);
  }

  public void warning(final String message) {
    log(message, ActionLevel.WARNING);
  }

  public void error(final String message) {
    log(message, ActionLevel.ERROR);
  }

  /**
   * Records an action.
   *
   * @param message description
   * @param level severity
   */
  public void log(final String message, final ActionLevel level) {
    Validate.notNull(message, "message must not be null");
    Validate.notNull(level, "level must not be null");

    switch (level) {
      case ERROR:
        LOGGER.error(message);
        break;
      case WARNING:
        LOGGER.warn(message);
        break;
      default:
        LOGGER.info(message);
        break;
    }

    final ActionEvent event = new ActionEvent(this.clock.instant(), message, level);
    synchronized (this.recent) {
      this.recent.addLast(event);
      while (this.recent.size() > this.capacity) {
        this.recent.removeFirst();
      }
    }
    this.events.action(event);
  }

  /**
   * Returns the retained entries, oldest first.
   *
   * @return snapshot of recent entries
   */
  public List<ActionEvent> recent() {
    synchronized (this.recent) {
      return List.copyOf(new ArrayList<>(this.recent));
    }
  }
}
