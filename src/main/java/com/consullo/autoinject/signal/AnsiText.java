package com.consullo.autoinject.signal;

import java.util.regex.Pattern;

/**
 * Removes ANSI control sequences from raw terminal output.
 *
 * @since 1.0
 */
public final class AnsiText {

  private static final Pattern CSI = Pattern.compile("\u001B\\[[0-9;?]*[a-zA-Z]");
  private static final Pattern OSC = Pattern.compile("\u001B\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)");

  private AnsiText() {
  }

  /**
   * Strips CSI and OSC sequences.
   *
   * @param text raw text (may be null)
   * @return plain text, never null
   */
  public static String strip(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    if (text.indexOf('\u001B') < 0) {
      return text;
    }
    String s = OSC.matcher(text).replaceAll("");
    return CSI.matcher(s).replaceAll("");
  }
}
