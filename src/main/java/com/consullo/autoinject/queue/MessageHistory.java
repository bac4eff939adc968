package com.consullo.autoinject.queue;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Bounded record of delivered messages, oldest dropped first.
 *
 * @since 1.0
 */
public final class MessageHistory {

  private final Clock clock;
  private final int capacity;
  private final Deque<HistoryEntry> entries = new ArrayDeque<>();

  public MessageHistory(final Clock clock, final int capacity) {
    Validate.notNull(clock, "clock must not be null");
    Validate.isTrue(capacity > 0, "capacity must be positive");
    this.clock = clock;
    this.capacity = capacity;
  }

  /**
   * Records a delivery at the current time.
   *
   * @param message delivered message
   * @return the new entry
   */
  public HistoryEntry record(final Message message) {
    Validate.notNull(message, "message must not be null");
    final HistoryEntry entry = new HistoryEntry(message.id(), message.content(), message.targetSessionId(),
        clock.instant(), message.createdAt());
    entries.addLast(entry);
    while (entries.size() > capacity) {
      entries.removeFirst();
    }
    return entry;
  }

  /**
   * Entries oldest first.
   *
   * @return immutable copy
   */
  public List<HistoryEntry> entries() {
    return List.copyOf(entries);
  }

  public int size() {
    return entries.size();
  }

  public void clear() {
    entries.clear();
  }
}
