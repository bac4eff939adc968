package com.consullo.autoinject.event;

/**
 * Severity of an {@link ActionEvent}.
 *
 * @since 1.0
 */
public enum ActionLevel {
  INFO,
  SUCCESS,
  WARNING,
  ERROR
}
