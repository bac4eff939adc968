package com.consullo.autoinject.core.jediterm;

import com.consullo.autoinject.core.TerminalSnapshot;
import com.jediterm.core.Color;
import com.jediterm.core.util.TermSize;
import com.jediterm.terminal.CursorShape;
import com.jediterm.terminal.RequestOrigin;
import com.jediterm.terminal.TerminalDisplay;
import com.jediterm.terminal.emulator.mouse.MouseFormat;
import com.jediterm.terminal.emulator.mouse.MouseMode;
import com.jediterm.terminal.model.TerminalSelection;
import java.time.Instant;

/**
 * Display with nothing to paint. Keeps the cursor position, alternate-screen flag, title and
 * bell count so they can be reported in {@link TerminalSnapshot}s.
 */
final class RecordingTerminalDisplay implements TerminalDisplay {

  private volatile int cursorColumn;
  private volatile int cursorRow;
  private volatile boolean alternateScreen;
  private volatile String windowTitle = "";
  private volatile int bells;

  TerminalSnapshot snapshot(final Instant now, final int columns, final int rows) {
    return new TerminalSnapshot(now, columns, rows, cursorColumn, cursorRow, alternateScreen, windowTitle, bells);
  }

  @Override
  public void setCursor(final int x, final int y) {
    cursorColumn = x;
    cursorRow = y;
  }

  @Override
  public void useAlternateScreenBuffer(final boolean enabled) {
    alternateScreen = enabled;
  }

  @Override
  public String getWindowTitle() {
    return windowTitle;
  }

  @Override
  public void setWindowTitle(final String title) {
    windowTitle = title == null ? "" : title;
  }

  @Override
  public void beep() {
    bells++;
  }

  // Rendering hooks; nothing is drawn.

  @Override
  public void setCursorShape(final CursorShape shape) {
  }

  @Override
  public void setCursorVisible(final boolean visible) {
  }

  @Override
  public void onResize(final TermSize size, final RequestOrigin origin) {
  }

  @Override
  public void scrollArea(final int top, final int size, final int dy) {
  }

  @Override
  public TerminalSelection getSelection() {
    return null;
  }

  @Override
  public void terminalMouseModeSet(final MouseMode mode) {
  }

  @Override
  public void setMouseFormat(final MouseFormat format) {
  }

  @Override
  public boolean ambiguousCharsAreDoubleWidth() {
    return false;
  }

  @Override
  public void setBracketedPasteMode(final boolean enabled) {
  }

  @Override
  public Color getWindowForeground() {
    return null;
  }

  @Override
  public Color getWindowBackground() {
    return null;
  }
}
