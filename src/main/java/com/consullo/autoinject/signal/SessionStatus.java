package com.consullo.autoinject.signal;

/**
 * Readiness classification of a session's recent output.
 *
 * @since 1.0
 */
public enum SessionStatus {
  /** Idle and able to accept input. */
  READY,
  /** The program is working (busy marker visible). */
  RUNNING,
  /** The program is asking a question and waits for an answer. */
  PROMPTING
}
