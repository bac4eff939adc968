package com.consullo.autoinject.session;

/**
 * Notified when a session produced output. Called from the transport's reader thread.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface SessionOutputListener {

  void onOutput(int sessionId);

  /**
   * The session's process exited or its channel was closed.
   *
   * @param sessionId id
   */
  default void onClosed(int sessionId) {
  }
}
