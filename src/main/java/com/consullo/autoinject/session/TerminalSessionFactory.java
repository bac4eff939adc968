package com.consullo.autoinject.session;

import com.consullo.autoinject.core.jediterm.JediTermCore;
import com.consullo.autoinject.pty.Pty4jProcessController;
import com.consullo.autoinject.pty.PtyProcessConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.lang3.Validate;

/**
 * Starts PTY-backed sessions and hands out their ids.
 *
 * <p>Every session gets its own JediTerm model of the same size as its pseudo terminal.
 *
 * @since 1.0
 */
public final class TerminalSessionFactory {

  /** Scrollback retained per session. */
  public static final int DEFAULT_HISTORY_LINES = 5_000;

  private final AtomicInteger nextId = new AtomicInteger(1);
  private final boolean ciMode;
  private final int columns;
  private final int rows;

  /**
   * @param ciMode whether spawned processes see {@code CI=1}
   * @param columns terminal width
   * @param rows terminal height
   */
  public TerminalSessionFactory(final boolean ciMode, final int columns, final int rows) {
    Validate.isTrue(columns > 0 && rows > 0, "terminal size must be positive: %dx%d", columns, rows);
    this.ciMode = ciMode;
    this.columns = columns;
    this.rows = rows;
  }

  /**
   * Starts a new session running {@code command}.
   *
   * @param command executable and arguments
   * @param workingDirectory start directory, or null for the current one
   * @return started session with a fresh id
   * @throws IOException if the process cannot be spawned
   */
  public PtyTerminalSession start(final List<String> command, final Path workingDirectory) throws IOException {
    final PtyProcessConfig config =
        PtyProcessConfig.inheritingEnvironment(command, workingDirectory, columns, rows, ciMode);
    final Pty4jProcessController pty = Pty4jProcessController.spawn(config);
    return PtyTerminalSession.start(nextId.getAndIncrement(), pty,
        new JediTermCore(columns, rows, DEFAULT_HISTORY_LINES));
  }
}
