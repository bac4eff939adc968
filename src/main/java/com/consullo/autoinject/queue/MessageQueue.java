package com.consullo.autoinject.queue;

import com.consullo.autoinject.event.ActionLog;
import com.consullo.autoinject.event.AutomationEvents;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pending messages keyed by id.
 *
 * <p>Storage order carries no meaning: delivery order is computed from
 * {@link Message#DELIVERY_ORDER} whenever it is needed. Every mutation is persisted through the
 * {@link QueueStore}; a failing store is logged and the in-memory queue stays authoritative.
 *
 * <p>Confined to the automation execution context.
 *
 * @since 1.0
 */
public final class MessageQueue {

  private static final Logger LOGGER = LoggerFactory.getLogger(MessageQueue.class);

  private final Clock clock;
  private final QueueStore store;
  private final ActionLog actionLog;
  private final AutomationEvents events;
  private final Map<Long, Message> messages = new LinkedHashMap<>();

  private long nextId = 1;
  private long nextSequence = 1;

  public MessageQueue(final Clock clock, final QueueStore store, final ActionLog actionLog,
      final AutomationEvents events) {
    Validate.notNull(clock, "clock must not be null");
    Validate.notNull(store, "store must not be null");
    Validate.notNull(actionLog, "actionLog must not be null");
    Validate.notNull(events, "events must not be null");
    this.clock = clock;
    this.store = store;
    this.actionLog = actionLog;
    this.events = events;
  }

  /**
   * Replaces the in-memory queue with the stored one. Id and sequence counters continue past the
   * largest loaded values.
   *
   * @return number of messages loaded
   */
  public int load() {
    final List<Message> loaded;
    try {
      loaded = store.load();
    } catch (final IOException e) {
      actionLog.error("Failed to load message queue: " + e.getMessage());
      LOGGER.warn("Queue load failed", e);
      return 0;
    }
    messages.clear();
    for (final Message m : loaded) {
      if (messages.putIfAbsent(m.id(), m) != null) {
        LOGGER.warn("Dropping stored message with duplicate id {}", m.id());
        continue;
      }
      nextId = Math.max(nextId, m.id() + 1);
      nextSequence = Math.max(nextSequence, m.sequence() + 1);
    }
    events.queueSizeChanged(messages.size());
    return messages.size();
  }

  public Message enqueue(final String content, final int targetSessionId) {
    return enqueue(content, targetSessionId, List.of(), Duration.ZERO);
  }

  /**
   * Adds a message that becomes due after {@code delay}.
   *
   * @param content text
   * @param targetSessionId session
   * @param attachments files typed ahead of the text
   * @param delay zero or positive
   * @return queued message
   */
  public Message enqueue(final String content, final int targetSessionId, final List<Attachment> attachments,
      final Duration delay) {
    return enqueue(content, targetSessionId, attachments, delay, Set.of());
  }

  /**
   * Adds a flagged message that becomes due after {@code delay}.
   *
   * @param content text
   * @param targetSessionId session
   * @param attachments files typed ahead of the text
   * @param delay zero or positive
   * @param flags markers
   * @return queued message
   */
  public Message enqueue(final String content, final int targetSessionId, final List<Attachment> attachments,
      final Duration delay, final Set<MessageFlag> flags) {
    Validate.notNull(delay, "delay must not be null");
    Validate.isTrue(!delay.isNegative(), "delay must not be negative");
    return enqueueAt(content, targetSessionId, attachments, clock.instant().plus(delay), flags);
  }

  /**
   * Adds a message due at an explicit instant.
   *
   * @param content text
   * @param targetSessionId session
   * @param attachments files typed ahead of the text
   * @param executeAt earliest dispatch time
   * @param flags markers
   * @return queued message
   */
  public Message enqueueAt(final String content, final int targetSessionId, final List<Attachment> attachments,
      final Instant executeAt, final Set<MessageFlag> flags) {
    Validate.notNull(content, "content must not be null");
    Validate.notNull(executeAt, "executeAt must not be null");
    final Message m = new Message(nextId++, content, null, targetSessionId, clock.instant(), executeAt,
        nextSequence++, flags, attachments);
    messages.put(m.id(), m);
    LOGGER.debug("Queued message {} for session {} at {}", m.id(), targetSessionId, executeAt);
    changed();
    return m;
  }

  public Optional<Message> get(final long id) {
    return Optional.ofNullable(messages.get(id));
  }

  /**
   * Removes a message.
   *
   * @param id message id
   * @return removed message, empty if it was not queued
   */
  public Optional<Message> remove(final long id) {
    final Message removed = messages.remove(id);
    if (removed != null) {
      changed();
    }
    return Optional.ofNullable(removed);
  }

  /**
   * Replaces the text of a queued message, keeping its position and attachments.
   *
   * @param id message id
   * @param content new text
   * @return true if the message was queued
   */
  public boolean updateContent(final long id, final String content) {
    Validate.notNull(content, "content must not be null");
    final Message m = messages.get(id);
    if (m == null) {
      return false;
    }
    messages.put(id, m.withContent(content));
    changed();
    return true;
  }

  /**
   * Swaps the message's delivery slot with the previous message for the same session.
   *
   * @param id message id
   * @return true if moved
   */
  public boolean moveEarlier(final long id) {
    return swapWithNeighbour(id, -1);
  }

  /**
   * Swaps the message's delivery slot with the next message for the same session.
   *
   * @param id message id
   * @return true if moved
   */
  public boolean moveLater(final long id) {
    return swapWithNeighbour(id, 1);
  }

  private boolean swapWithNeighbour(final long id, final int direction) {
    final Message m = messages.get(id);
    if (m == null) {
      return false;
    }
    final List<Message> ordered = forSession(m.targetSessionId());
    final int index = ordered.indexOf(m);
    final int other = index + direction;
    if (index < 0 || other < 0 || other >= ordered.size()) {
      return false;
    }
    final Message n = ordered.get(other);
    messages.put(m.id(), m.withSlot(n.executeAt(), n.sequence()));
    messages.put(n.id(), n.withSlot(m.executeAt(), m.sequence()));
    changed();
    return true;
  }

  /**
   * Empties the queue.
   *
   * @return number of messages removed
   */
  public int clear() {
    final int count = messages.size();
    if (count > 0) {
      messages.clear();
      changed();
    }
    return count;
  }

  /**
   * All messages in delivery order.
   *
   * @return immutable list
   */
  public List<Message> all() {
    final List<Message> out = new ArrayList<>(messages.values());
    out.sort(Message.DELIVERY_ORDER);
    return List.copyOf(out);
  }

  public List<Message> forSession(final int sessionId) {
    final List<Message> out = new ArrayList<>();
    for (final Message m : messages.values()) {
      if (m.targetSessionId() == sessionId) {
        out.add(m);
      }
    }
    out.sort(Message.DELIVERY_ORDER);
    return out;
  }

  /**
   * Earliest execute time among a session's messages.
   *
   * @param sessionId session
   * @return earliest execute time, empty if the session has none queued
   */
  public Optional<Instant> earliestExecuteAt(final int sessionId) {
    return forSession(sessionId).stream().map(Message::executeAt).findFirst();
  }

  /**
   * For each session not in {@code excludedSessions}, the first due message in delivery order.
   *
   * @param now current time
   * @param excludedSessions sessions to skip (busy ones)
   * @return candidate by session id, ordered by session id
   */
  public Map<Integer, Message> dueCandidates(final Instant now, final Collection<Integer> excludedSessions) {
    final Map<Integer, Message> best = new TreeMap<>();
    for (final Message m : messages.values()) {
      if (excludedSessions.contains(m.targetSessionId()) || m.executeAt().isAfter(now)) {
        continue;
      }
      best.merge(m.targetSessionId(), m, (a, b) -> Message.DELIVERY_ORDER.compare(a, b) <= 0 ? a : b);
    }
    return best;
  }

  public int size() {
    return messages.size();
  }

  public boolean isEmpty() {
    return messages.isEmpty();
  }

  public QueueStats stats() {
    final Instant now = clock.instant();
    final Map<Integer, Integer> perSession = new TreeMap<>();
    int due = 0;
    for (final Message m : messages.values()) {
      perSession.merge(m.targetSessionId(), 1, Integer::sum);
      if (!m.executeAt().isAfter(now)) {
        due++;
      }
    }
    return new QueueStats(messages.size(), Collections.unmodifiableMap(perSession), due);
  }

  private void changed() {
    persist();
    events.queueSizeChanged(messages.size());
  }

  private void persist() {
    try {
      store.save(all());
    } catch (final IOException | RuntimeException e) {
      LOGGER.warn("Queue persistence failed: {}", e.getMessage(), e);
      actionLog.error("Failed to save message queue: " + e.getMessage());
    }
  }
}
