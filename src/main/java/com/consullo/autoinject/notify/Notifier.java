package com.consullo.autoinject.notify;

/**
 * Best-effort user notification.
 *
 * <p>Implementations may drop notifications when no notification facility is available. Callers
 * catch and log anything thrown.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface Notifier {

  /** Notifier that discards everything. */
  Notifier NONE = (title, body) -> {
  };

  void notify(String title, String body);
}
