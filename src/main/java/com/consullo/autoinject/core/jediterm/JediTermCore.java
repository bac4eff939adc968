package com.consullo.autoinject.core.jediterm;

import com.consullo.autoinject.core.ScrollbackView;
import com.consullo.autoinject.core.TerminalCore;
import com.consullo.autoinject.core.TerminalSnapshot;
import com.consullo.autoinject.core.events.ScreenChangeListener;
import com.jediterm.core.util.TermSize;
import com.jediterm.terminal.RequestOrigin;
import com.jediterm.terminal.emulator.JediEmulator;
import com.jediterm.terminal.model.JediTerminal;
import com.jediterm.terminal.model.StyleState;
import com.jediterm.terminal.model.TerminalLine;
import com.jediterm.terminal.model.TerminalTextBuffer;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntUnaryOperator;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TerminalCore} on top of JediTerm's headless model.
 *
 * <p>Bytes are decoded by {@link Utf8TerminalDataStream}, parsed by a {@link JediEmulator} and
 * applied to a {@link JediTerminal}. Rendered rows live in a {@link TerminalTextBuffer}, where
 * negative line indices address scrollback history.
 *
 * @since 1.0
 */
public final class JediTermCore implements TerminalCore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JediTermCore.class);

  private final Object lock = new Object();
  private final Clock clock;
  private final Utf8TerminalDataStream input = new Utf8TerminalDataStream();
  private final RecordingTerminalDisplay display = new RecordingTerminalDisplay();
  private final TerminalTextBuffer buffer;
  private final JediTerminal terminal;
  private final JediEmulator emulator;
  private final ScrollbackView scrollback = new BufferView();
  private final List<ScreenChangeListener> listeners = new CopyOnWriteArrayList<>();

  private int columns;
  private int rows;

  /**
   * @param columns screen width
   * @param rows screen height
   * @param historyLines scrollback lines kept once rows scroll off the screen
   */
  public JediTermCore(final int columns, final int rows, final int historyLines) {
    this(columns, rows, historyLines, Clock.systemUTC());
  }

  JediTermCore(final int columns, final int rows, final int historyLines, final Clock clock) {
    Validate.isTrue(columns > 0 && rows > 0, "terminal size must be positive: %dx%d", columns, rows);
    Validate.isTrue(historyLines > 0, "historyLines must be positive");
    this.clock = clock;
    this.columns = columns;
    this.rows = rows;
    final StyleState style = new StyleState();
    this.buffer = new TerminalTextBuffer(columns, rows, style, historyLines);
    this.terminal = new JediTerminal(display, buffer, style);
    this.emulator = new JediEmulator(input, terminal);
  }

  @Override
  public void feed(final byte[] data, final int offset, final int length) {
    Validate.notNull(data, "data must not be null");
    if (length <= 0) {
      return;
    }
    input.appendBytes(data, offset, length);
    final int applied;
    synchronized (lock) {
      applied = drainEmulator();
    }
    if (applied > 0) {
      publish(snapshot());
    }
  }

  // The emulator latches EOF whenever the stream runs dry, so clear it before every drain.
  private int drainEmulator() {
    emulator.resetEof();
    int steps = 0;
    try {
      while (emulator.hasNext()) {
        emulator.next();
        steps++;
      }
    } catch (final IOException e) {
      LOGGER.debug("Input exhausted after {} emulator steps", steps);
    } catch (final RuntimeException e) {
      LOGGER.warn("Emulator rejected output after {} steps: {}", steps, e.getMessage());
    }
    return steps;
  }

  @Override
  public TerminalSnapshot snapshot() {
    synchronized (lock) {
      return display.snapshot(clock.instant(), columns, rows);
    }
  }

  @Override
  public ScrollbackView scrollback() {
    return scrollback;
  }

  @Override
  public void addScreenChangeListener(final ScreenChangeListener listener) {
    Validate.notNull(listener, "listener must not be null");
    listeners.add(listener);
  }

  @Override
  public void resize(final int columns, final int rows) {
    Validate.isTrue(columns > 0 && rows > 0, "terminal size must be positive: %dx%d", columns, rows);
    synchronized (lock) {
      this.columns = columns;
      this.rows = rows;
      final TermSize size = new TermSize(columns, rows);
      buffer.resize(size, null, null);
      terminal.resize(size, RequestOrigin.Remote);
    }
    publish(snapshot());
  }

  private void publish(final TerminalSnapshot snapshot) {
    for (final ScreenChangeListener listener : listeners) {
      try {
        listener.onScreenChanged(snapshot);
      } catch (final RuntimeException e) {
        LOGGER.warn("Screen change listener failed: {}", e.getMessage(), e);
      }
    }
  }

  /**
   * Plain text of a rendered row. Unwritten cells come back as NUL; they read as spaces, and
   * trailing blanks are dropped.
   */
  static String plainText(final TerminalLine line) {
    if (line == null || line.getEntries() == null) {
      return "";
    }
    final StringBuilder text = new StringBuilder();
    for (final TerminalLine.TextEntry entry : line.getEntries()) {
      if (entry != null && entry.getText() != null) {
        text.append(entry.getText());
      }
    }
    return StringUtils.stripEnd(text.toString().replace('\0', ' '), " \t");
  }

  /** Reads history through negative buffer indices and the screen through positive ones. */
  private final class BufferView implements ScrollbackView {

    @Override
    public int historyLineCount() {
      synchronized (lock) {
        return buffer.getHistoryLinesCount();
      }
    }

    @Override
    public int screenRowCount() {
      synchronized (lock) {
        return buffer.getHeight();
      }
    }

    @Override
    public List<String> readHistoryLines(final int startInclusive, final int endExclusive) {
      synchronized (lock) {
        final int history = buffer.getHistoryLinesCount();
        return rows(startInclusive, Math.min(endExclusive, history), index -> index - history);
      }
    }

    @Override
    public List<String> readScreenLines(final int startInclusive, final int endExclusive) {
      synchronized (lock) {
        return rows(startInclusive, Math.min(endExclusive, buffer.getHeight()), index -> index);
      }
    }

    @Override
    public String tailText(final int maxChars) {
      synchronized (lock) {
        return ScrollbackView.super.tailText(maxChars);
      }
    }

    private List<String> rows(final int from, final int to, final IntUnaryOperator bufferIndex) {
      final List<String> lines = new ArrayList<>(Math.max(0, to - from));
      for (int index = Math.max(0, from); index < to; index++) {
        lines.add(plainText(buffer.getLine(bufferIndex.applyAsInt(index))));
      }
      return lines;
    }
  }
}
