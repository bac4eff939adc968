package com.consullo.autoinject.session;

import com.consullo.autoinject.signal.SessionStatus;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of per-session state and channels, keyed by session id.
 *
 * <p>State is created when a session first reports output (or is opened explicitly) and removed
 * when the session closes. Not thread-safe: confined to the automation execution context.
 *
 * @since 1.0
 */
public final class SessionRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

  private final Clock clock;
  private final Map<Integer, SessionState> states = new TreeMap<>();
  private final Map<Integer, SessionChannel> channels = new TreeMap<>();

  public SessionRegistry(final Clock clock) {
    Validate.notNull(clock, "clock must not be null");
    this.clock = clock;
  }

  /**
   * Registers a channel and creates its state.
   *
   * @param channel session channel
   * @return state
   */
  public SessionState attach(final SessionChannel channel) {
    Validate.notNull(channel, "channel must not be null");
    this.channels.put(channel.id(), channel);
    return open(channel.id());
  }

  /**
   * Returns the state for the id, creating it if absent.
   *
   * @param sessionId id
   * @return state
   */
  public SessionState open(final int sessionId) {
    return this.states.computeIfAbsent(sessionId, id -> {
      LOGGER.debug("Tracking session {}", id);
      return new SessionState(id, this.clock.instant());
    });
  }

  /**
   * Forgets the session. The channel is not closed here.
   *
   * @param sessionId id
   * @return true if the session was known
   */
  public boolean close(final int sessionId) {
    this.channels.remove(sessionId);
    return this.states.remove(sessionId) != null;
  }

  public Optional<SessionState> get(final int sessionId) {
    return Optional.ofNullable(this.states.get(sessionId));
  }

  public Optional<SessionChannel> channel(final int sessionId) {
    return Optional.ofNullable(this.channels.get(sessionId));
  }

  public Collection<SessionState> all() {
    return Collections.unmodifiableCollection(this.states.values());
  }

  public Collection<SessionChannel> channels() {
    return Collections.unmodifiableCollection(this.channels.values());
  }

  public boolean contains(final int sessionId) {
    return this.states.containsKey(sessionId);
  }

  public SessionState updateStatus(final int sessionId, final SessionStatus status) {
    final SessionState state = open(sessionId);
    state.updateStatus(status, this.clock.instant());
    return state;
  }

  public Set<Integer> busySessionIds() {
    final Set<Integer> out = new TreeSet<>();
    for (final SessionState s : this.states.values()) {
      if (s.isBusy()) {
        out.add(s.sessionId());
      }
    }
    return out;
  }

  public List<Integer> awaitingContinueIds() {
    final List<Integer> out = new ArrayList<>();
    for (final SessionState s : this.states.values()) {
      if (s.isAwaitingContinue()) {
        out.add(s.sessionId());
      }
    }
    return out;
  }

  public void beginInjection(final int sessionId) {
    open(sessionId).beginInjection();
  }

  public void endInjection(final int sessionId) {
    get(sessionId).ifPresent(s -> s.endInjection(this.clock.instant()));
  }

  public void markUsageLimit(final int sessionId) {
    open(sessionId).markUsageLimit();
  }

  public void clearUsageLimit(final int sessionId) {
    get(sessionId).ifPresent(SessionState::clearUsageLimit);
  }

  public void clearAllUsageLimits() {
    this.states.values().forEach(SessionState::clearUsageLimit);
  }

  public void setBlocked(final int sessionId, final boolean blocked) {
    get(sessionId).ifPresent(s -> s.setBlocked(blocked));
  }

  public void setResponderArmed(final int sessionId, final boolean armed) {
    get(sessionId).ifPresent(s -> s.setResponderArmed(armed));
  }

  /**
   * Counts a failed readiness check.
   *
   * @param sessionId id
   * @return consecutive failed checks
   */
  public int recordNotReady(final int sessionId) {
    return open(sessionId).incrementNotReadyChecks();
  }

  public void resetNotReady(final int sessionId) {
    get(sessionId).ifPresent(SessionState::resetNotReadyChecks);
  }

  /**
   * Returns every session to a neutral state: not busy, not blocked, not armed.
   */
  public void neutralizeAll() {
    for (final SessionState s : this.states.values()) {
      s.neutralize(this.clock.instant(), false);
    }
  }

  public List<SessionView> views() {
    final List<SessionView> out = new ArrayList<>(this.states.size());
    for (final SessionState s : this.states.values()) {
      out.add(s.view());
    }
    return out;
  }
}
