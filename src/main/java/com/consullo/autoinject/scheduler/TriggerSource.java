package com.consullo.autoinject.scheduler;

/**
 * Why a selection pass was requested.
 *
 * @since 1.0
 */
public enum TriggerSource {
  /** The countdown expired. Starts draining. */
  TIMER_EXPIRY(true),
  /** The user asked to send queued messages now. Starts draining. */
  MANUAL(true),
  /** An injection finished. */
  INJECTION_COMPLETE(false),
  /** A scheduled wake-up for messages not yet due or sessions not yet ready. */
  WAKE(false),
  /** A session was unblocked or injection resumed. */
  RELEASE(false),
  /** A message was added. */
  ENQUEUE(false);

  private final boolean startsDrain;

  TriggerSource(final boolean startsDrain) {
    this.startsDrain = startsDrain;
  }

  public boolean startsDrain() {
    return startsDrain;
  }
}
