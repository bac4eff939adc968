package com.consullo.autoinject.engine;

import com.consullo.autoinject.event.ActionLog;
import com.consullo.autoinject.usage.UsageLimitTracker;
import java.util.Locale;
import org.apache.commons.lang3.Validate;

/**
 * Slash commands typed into the message box that act on the automation instead of being queued.
 *
 * @since 1.0
 */
final class SpecialCommands {

  static final String USAGE_LIMIT_STATUS = "/usage-limit-status";
  static final String USAGE_LIMIT_RESET = "/usage-limit-reset";
  static final String HELP = "/help";

  private final UsageLimitTracker tracker;
  private final ActionLog actionLog;

  SpecialCommands(final UsageLimitTracker tracker, final ActionLog actionLog) {
    Validate.notNull(tracker, "tracker must not be null");
    Validate.notNull(actionLog, "actionLog must not be null");
    this.tracker = tracker;
    this.actionLog = actionLog;
  }

  /**
   * Runs the command if {@code text} is one.
   *
   * @param text submitted text
   * @return true if handled; the text must then not be queued
   */
  boolean handle(final String text) {
    if (text == null) {
      return false;
    }
    final String command = text.trim().toLowerCase(Locale.ROOT);
    if (command.startsWith(USAGE_LIMIT_STATUS)) {
      actionLog.info(tracker.describe());
      return true;
    }
    if (command.startsWith(USAGE_LIMIT_RESET)) {
      tracker.reset();
      actionLog.success("Usage-limit state reset");
      return true;
    }
    if (command.equals(HELP)) {
      actionLog.info("Commands: " + USAGE_LIMIT_STATUS + " (show usage-limit state), "
          + USAGE_LIMIT_RESET + " (clear usage-limit state), " + HELP);
      return true;
    }
    return false;
  }
}
