package com.consullo.autoinject.signal;

import com.consullo.autoinject.keyword.KeywordRule;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.Validate;

/**
 * Classifies the trailing output of one session.
 *
 * <p>Every method is a pure function of its arguments and the pattern table; no state crosses
 * sessions or calls. Garbage or empty input yields {@link SessionStatus#READY} with no signals.
 *
 * @since 1.0
 */
public final class SessionSignalDetector {

  private final SignalPatterns patterns;
  private final int windowChars;
  private final int fallbackChars;

  /**
   * Creates a detector.
   *
   * @param patterns rule table
   * @param windowChars characters of trailing output considered
   * @param fallbackChars size of the fallback prompt search area when no box marker is present
   */
  public SessionSignalDetector(final SignalPatterns patterns, final int windowChars, final int fallbackChars) {
    Validate.notNull(patterns, "patterns must not be null");
    Validate.isTrue(windowChars > 0, "windowChars must be positive");
    Validate.isTrue(fallbackChars > 0, "fallbackChars must be positive");
    this.patterns = patterns;
    this.windowChars = windowChars;
    this.fallbackChars = fallbackChars;
  }

  /**
   * Runs every detector over the trailing window of {@code output}.
   *
   * @param output recent output, raw or rendered
   * @param keywordRules rules checked against the prompt area, in order
   * @return report
   */
  public SignalReport analyze(final String output, final List<KeywordRule> keywordRules) {
    final String window = window(output);
    final SessionStatus status = classify(window);
    final UsageLimitMatch usage = detectUsageLimit(window).orElse(null);
    final PromptArea area = findPromptArea(window).orElse(null);

    KeywordRule keyword = null;
    boolean continuation = false;
    if (area != null) {
      keyword = findKeyword(area, keywordRules).orElse(null);
      continuation = isContinuationPrompt(area);
    }
    return new SignalReport(status, area, usage, keyword, continuation);
  }

  /**
   * Bounded, ANSI-free tail of the output.
   *
   * @param output raw output
   * @return window
   */
  public String window(final String output) {
    final String plain = AnsiText.strip(output);
    if (plain.length() <= windowChars) {
      return plain;
    }
    return plain.substring(plain.length() - windowChars);
  }

  /**
   * Running beats prompting beats ready.
   *
   * @param window trailing window
   * @return status
   */
  public SessionStatus classify(final String window) {
    if (window == null || window.isEmpty()) {
      return SessionStatus.READY;
    }
    for (final String marker : patterns.runningMarkers()) {
      if (window.contains(marker)) {
        return SessionStatus.RUNNING;
      }
    }
    for (final String literal : patterns.promptLiterals()) {
      if (window.contains(literal)) {
        return SessionStatus.PROMPTING;
      }
    }
    for (final Pattern p : patterns.promptPatterns()) {
      if (p.matcher(window).find()) {
        return SessionStatus.PROMPTING;
      }
    }
    return SessionStatus.READY;
  }

  /**
   * Locates the last prompt box. Without a marker, the tail of the window is used only if it
   * contains the safety-box phrase.
   *
   * @param window trailing window
   * @return search area
   */
  public Optional<PromptArea> findPromptArea(final String window) {
    if (window == null || window.isBlank()) {
      return Optional.empty();
    }
    final int start = window.lastIndexOf(patterns.promptBoxMarker());
    if (start >= 0) {
      return Optional.of(new PromptArea(window.substring(start), true));
    }
    final String tail = window.length() <= fallbackChars ? window : window.substring(window.length() - fallbackChars);
    if (tail.contains(patterns.safetyBoxPhrase())) {
      return Optional.of(new PromptArea(tail, false));
    }
    return Optional.empty();
  }

  /**
   * Case-insensitive substring match of each rule, first match wins.
   *
   * @param area prompt area
   * @param rules rules in priority order
   * @return first matching rule
   */
  public Optional<KeywordRule> findKeyword(final PromptArea area, final List<KeywordRule> rules) {
    if (area == null || rules == null || rules.isEmpty()) {
      return Optional.empty();
    }
    final String haystack = area.text().toLowerCase(Locale.ROOT);
    for (final KeywordRule rule : rules) {
      final String needle = rule.keyword().trim().toLowerCase(Locale.ROOT);
      if (!needle.isEmpty() && haystack.contains(needle)) {
        return Optional.of(rule);
      }
    }
    return Optional.empty();
  }

  public boolean isContinuationPrompt(final PromptArea area) {
    return area != null && patterns.continuationPrompt().matcher(area.text()).find();
  }

  /**
   * Parses the usage-limit notice. Out-of-range hours are treated as no match.
   *
   * @param window trailing window
   * @return parsed notice
   */
  public Optional<UsageLimitMatch> detectUsageLimit(final String window) {
    if (window == null || window.isEmpty()) {
      return Optional.empty();
    }
    final Matcher m = patterns.usageLimit().matcher(window);
    UsageLimitMatch last = null;
    while (m.find()) {
      final int hour;
      try {
        hour = Integer.parseInt(m.group(1));
      } catch (final NumberFormatException e) {
        continue;
      }
      if (hour < 1 || hour > 12) {
        continue;
      }
      last = new UsageLimitMatch(hour, "pm".equalsIgnoreCase(m.group(2)));
    }
    return Optional.ofNullable(last);
  }
}
