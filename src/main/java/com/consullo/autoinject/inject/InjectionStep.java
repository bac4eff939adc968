package com.consullo.autoinject.inject;

/**
 * States of an {@link InjectionTask}.
 *
 * @since 1.0
 */
public enum InjectionStep {
  TYPING,
  SUBMITTING,
  SETTLING,
  DONE
}
