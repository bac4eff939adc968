package com.consullo.autoinject.signal;

import com.consullo.autoinject.keyword.KeywordRule;
import java.util.Optional;

/**
 * Result of classifying one output window.
 *
 * @since 1.0
 */
public final class SignalReport {

  private final SessionStatus status;
  private final PromptArea promptArea;
  private final UsageLimitMatch usageLimit;
  private final KeywordRule keywordMatch;
  private final boolean continuationPrompt;

  SignalReport(SessionStatus status, PromptArea promptArea, UsageLimitMatch usageLimit,
               KeywordRule keywordMatch, boolean continuationPrompt) {
    this.status = status;
    this.promptArea = promptArea;
    this.usageLimit = usageLimit;
    this.keywordMatch = keywordMatch;
    this.continuationPrompt = continuationPrompt;
  }

  public SessionStatus status() {
    return status;
  }

  public Optional<PromptArea> promptArea() {
    return Optional.ofNullable(promptArea);
  }

  public Optional<UsageLimitMatch> usageLimit() {
    return Optional.ofNullable(usageLimit);
  }

  /**
   * First keyword rule found in the prompt area, if any.
   *
   * @return matched rule
   */
  public Optional<KeywordRule> keywordMatch() {
    return Optional.ofNullable(keywordMatch);
  }

  public boolean continuationPrompt() {
    return continuationPrompt;
  }

  @Override
  public String toString() {
    return "SignalReport{status=" + status
        + ", promptArea=" + (promptArea != null)
        + ", usageLimit=" + usageLimit
        + ", keyword=" + (keywordMatch != null ? keywordMatch.keyword() : null)
        + ", continuationPrompt=" + continuationPrompt + '}';
  }
}
