package com.consullo.autoinject.signal;

import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.lang3.Validate;

/**
 * Rule table driving {@link SessionSignalDetector}.
 *
 * <p>Kept as data so a different target program can be supported by supplying another table.
 *
 * @param runningMarkers literal substrings that mean the program is busy
 * @param promptLiterals literal substrings that mean a question is pending
 * @param promptPatterns regular expressions that mean a question is pending
 * @param promptBoxMarker character that opens the program's prompt box
 * @param safetyBoxPhrase phrase required in the fallback search area when no box marker is present
 * @param continuationPrompt pattern identifying the generic continuation prompt
 * @param usageLimit pattern with two groups: reset hour and am/pm
 * @since 1.0
 */
public record SignalPatterns(
    List<String> runningMarkers,
    List<String> promptLiterals,
    List<Pattern> promptPatterns,
    String promptBoxMarker,
    String safetyBoxPhrase,
    Pattern continuationPrompt,
    Pattern usageLimit) {

  public SignalPatterns {
    Validate.notNull(runningMarkers, "runningMarkers must not be null");
    Validate.notNull(promptLiterals, "promptLiterals must not be null");
    Validate.notNull(promptPatterns, "promptPatterns must not be null");
    Validate.notEmpty(promptBoxMarker, "promptBoxMarker must not be empty");
    Validate.notEmpty(safetyBoxPhrase, "safetyBoxPhrase must not be empty");
    Validate.notNull(continuationPrompt, "continuationPrompt must not be null");
    Validate.notNull(usageLimit, "usageLimit must not be null");
    runningMarkers = List.copyOf(runningMarkers);
    promptLiterals = List.copyOf(promptLiterals);
    promptPatterns = List.copyOf(promptPatterns);
  }

  /**
   * Patterns for the Claude Code CLI.
   *
   * @return default table
   */
  public static SignalPatterns claudeCode() {
    return new SignalPatterns(
        List.of("esc to interrupt", "ESC to interrupt", "offline)"),
        List.of(
            "No, and tell Claude what to do differently",
            "No, keep planning",
            "Do you trust the files in this folder?"),
        List.of(
            Pattern.compile("\\b[yY]/[nN]\\b"),
            Pattern.compile("\\b[nN]/[yY]\\b"),
            Pattern.compile("Do you want to proceed\\?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Continue\\?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\?\\s*$")),
        "\u256D",
        "No, and tell Claude what to do differently",
        Pattern.compile("No, and tell Claude what to do differently", Pattern.CASE_INSENSITIVE),
        Pattern.compile("Claude usage limit reached\\. Your limit will reset at (\\d{1,2})(am|pm)",
            Pattern.CASE_INSENSITIVE));
  }
}
