package com.consullo.autoinject.event;

import java.time.Instant;

/**
 * One entry of the user-facing action log.
 *
 * @param timestamp when the action was logged
 * @param message human-readable description
 * @param level severity
 * @since 1.0
 */
public record ActionEvent(Instant timestamp, String message, ActionLevel level) {
}
