package com.consullo.autoinject.core;

import com.consullo.autoinject.core.events.ScreenChangeListener;

/**
 * Emulated terminal that session output is rendered into.
 *
 * <p>Detectors read {@link #recentText(int)}, the rendered rows, instead of the raw byte stream.
 * Colour codes, cursor addressing and carriage-return redraws are resolved before text reaches
 * them.
 *
 * @since 1.0
 */
public interface TerminalCore {

  /**
   * Applies a chunk of process output. Calls must come from one thread at a time.
   *
   * @param data output bytes
   * @param offset first byte to apply
   * @param length number of bytes to apply
   */
  void feed(byte[] data, int offset, int length);

  TerminalSnapshot snapshot();

  /**
   * Live view over history and screen; reads reflect output fed after the call.
   *
   * @return scrollback view
   */
  ScrollbackView scrollback();

  void resize(int columns, int rows);

  void addScreenChangeListener(ScreenChangeListener listener);

  /**
   * Trailing rendered text, see {@link ScrollbackView#tailText(int)}.
   *
   * @param maxChars maximum length
   * @return text
   */
  default String recentText(final int maxChars) {
    return scrollback().tailText(maxChars);
  }
}
