package com.consullo.autoinject.core.jediterm;

import com.consullo.autoinject.core.ScrollbackView;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Scrollback view over plain lists of lines, for sessions whose output is not emulated and for
 * tests.
 *
 * @since 1.0
 */
public final class InMemoryScrollbackView implements ScrollbackView {

  private final List<String> history;
  private final List<String> screen;

  /**
   * Creates a view with history only.
   *
   * @param history backing history list
   */
  public InMemoryScrollbackView(final List<String> history) {
    this(history, Collections.emptyList());
  }

  /**
   * Creates a view over history and screen rows.
   *
   * @param history backing history list, oldest first
   * @param screen backing screen rows, top first
   */
  public InMemoryScrollbackView(final List<String> history, final List<String> screen) {
    Validate.notNull(history, "history must not be null");
    Validate.notNull(screen, "screen must not be null");
    this.history = history;
    this.screen = screen;
  }

  @Override
  public int historyLineCount() {
    return this.history.size();
  }

  @Override
  public int screenRowCount() {
    return this.screen.size();
  }

  @Override
  public List<String> readHistoryLines(final int startInclusive, final int endExclusive) {
    return slice(this.history, startInclusive, endExclusive);
  }

  @Override
  public List<String> readScreenLines(final int startInclusive, final int endExclusive) {
    return slice(this.screen, startInclusive, endExclusive);
  }

  private static List<String> slice(final List<String> lines, final int startInclusive, final int endExclusive) {
    Validate.isTrue(startInclusive >= 0, "startInclusive must be non-negative");
    Validate.isTrue(endExclusive >= startInclusive, "endExclusive must be >= startInclusive");

    final int end = Math.min(endExclusive, lines.size());
    if (startInclusive >= end) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(lines.subList(startInclusive, end)));
  }
}
