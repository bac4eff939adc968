package com.consullo.autoinject.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * Read-only view over terminal history and screen content.
 *
 * <p>History lines are scrolled-off content (stable). Screen lines are the current display and
 * may still change.
 *
 * @since 1.0
 */
public interface ScrollbackView {

  /** History lines fetched per read when walking backwards. */
  int TAIL_CHUNK_LINES = 32;

  /**
   * Returns the number of history lines (scrolled off screen).
   *
   * @return history line count
   */
  int historyLineCount();

  /**
   * Returns the number of visible screen rows.
   *
   * @return screen row count
   */
  int screenRowCount();

  /**
   * Returns history lines for the range [startInclusive, endExclusive). Index 0 is the oldest.
   *
   * @param startInclusive start line index inclusive
   * @param endExclusive end line index exclusive
   * @return plain text lines, right-trimmed
   */
  List<String> readHistoryLines(int startInclusive, int endExclusive);

  /**
   * Returns screen lines for the range [startInclusive, endExclusive). Index 0 is the top row.
   *
   * @param startInclusive start row index inclusive
   * @param endExclusive end row index exclusive
   * @return plain text lines, right-trimmed
   */
  List<String> readScreenLines(int startInclusive, int endExclusive);

  /**
   * Returns the last {@code maxChars} characters of history followed by the screen, lines joined
   * with {@code '\n'}. Blank rows below the last written screen row are ignored.
   *
   * @param maxChars maximum length of the result
   * @return trailing text
   */
  default String tailText(final int maxChars) {
    Validate.isTrue(maxChars > 0, "maxChars must be positive");

    final Deque<String> tail = new ArrayDeque<>();
    int budget = maxChars;

    final List<String> screen = readScreenLines(0, screenRowCount());
    int last = screen.size();
    while (last > 0 && screen.get(last - 1).isBlank()) {
      last--;
    }
    for (int i = last - 1; i >= 0 && budget > 0; i--) {
      final String line = screen.get(i);
      tail.addFirst(line);
      budget -= line.length() + 1;
    }

    int end = historyLineCount();
    while (budget > 0 && end > 0) {
      final int start = Math.max(0, end - TAIL_CHUNK_LINES);
      final List<String> chunk = readHistoryLines(start, end);
      for (int i = chunk.size() - 1; i >= 0 && budget > 0; i--) {
        final String line = chunk.get(i);
        tail.addFirst(line);
        budget -= line.length() + 1;
      }
      end = start;
    }

    final String joined = String.join("\n", tail);
    if (joined.length() <= maxChars) {
      return joined;
    }
    return joined.substring(joined.length() - maxChars);
  }
}
