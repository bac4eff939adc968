package com.consullo.autoinject.inject;

/**
 * Outcome of one injection. A failed message is not re-queued.
 *
 * @param messageId message id
 * @param sessionId target session
 * @param success true if the submit keystroke was written
 * @param error failure description, null on success
 * @since 1.0
 */
public record InjectionResult(long messageId, int sessionId, boolean success, String error) {

  static InjectionResult ok(final long messageId, final int sessionId) {
    return new InjectionResult(messageId, sessionId, true, null);
  }

  static InjectionResult failed(final long messageId, final int sessionId, final String error) {
    return new InjectionResult(messageId, sessionId, false, error);
  }
}
