package com.consullo.autoinject.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes notifications to the log, for headless use.
 *
 * @since 1.0
 */
public final class LoggingNotifier implements Notifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingNotifier.class);

  @Override
  public void notify(final String title, final String body) {
    LOGGER.info("[{}] {}", title, body);
  }
}
