package com.consullo.autoinject.session;

import com.consullo.autoinject.core.TerminalCore;
import com.consullo.autoinject.pty.PtyProcessController;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SessionChannel} over a process running in a pseudo terminal.
 *
 * <p>A daemon reader thread feeds the process output into a {@link TerminalCore} and reports
 * each chunk to the output listener. {@link #recentOutput(int)} answers from the rendered rows,
 * so cursor movement and in-place redraws are already resolved when detectors see the text.
 *
 * @since 1.0
 */
public final class PtyTerminalSession implements SessionChannel {

  private static final Logger LOGGER = LoggerFactory.getLogger(PtyTerminalSession.class);

  private static final int READ_BUFFER_SIZE = 8192;

  private final int id;
  private final PtyProcessController pty;
  private final TerminalCore core;
  private final AtomicBoolean closed = new AtomicBoolean();

  private volatile SessionOutputListener outputListener;

  private PtyTerminalSession(final int id, final PtyProcessController pty, final TerminalCore core) {
    this.id = id;
    this.pty = pty;
    this.core = core;
  }

  /**
   * Wraps a started process and begins reading its output.
   *
   * @param id session id
   * @param pty started process
   * @param core terminal model fed with the process output
   * @return session
   * @throws IOException if the process output cannot be opened
   */
  public static PtyTerminalSession start(final int id, final PtyProcessController pty, final TerminalCore core)
      throws IOException {
    Validate.notNull(pty, "pty must not be null");
    Validate.notNull(core, "core must not be null");

    final PtyTerminalSession session = new PtyTerminalSession(id, pty, core);
    final Thread reader = new Thread(session.readLoop(pty.output()), "session-" + id + "-reader");
    reader.setDaemon(true);
    reader.start();
    pty.onExit().whenComplete((code, error) -> session.markClosed());
    return session;
  }

  @Override
  public int id() {
    return id;
  }

  public TerminalCore core() {
    return core;
  }

  @Override
  public void write(final String text) throws IOException {
    Validate.notNull(text, "text must not be null");
    if (closed.get()) {
      throw new IOException("Session " + id + " is closed");
    }
    final OutputStream in = pty.input();
    in.write(text.getBytes(StandardCharsets.UTF_8));
    in.flush();
  }

  @Override
  public String recentOutput(final int maxChars) {
    return core.recentText(maxChars);
  }

  @Override
  public void setOutputListener(final SessionOutputListener listener) {
    this.outputListener = listener;
  }

  private Runnable readLoop(final InputStream out) {
    return () -> {
      final byte[] buffer = new byte[READ_BUFFER_SIZE];
      try {
        int n;
        while (!closed.get() && (n = out.read(buffer)) >= 0) {
          core.feed(buffer, 0, n);
          final SessionOutputListener listener = outputListener;
          if (listener != null) {
            listener.onOutput(id);
          }
        }
      } catch (final IOException e) {
        if (!closed.get()) {
          LOGGER.debug("Session {} output ended: {}", id, e.getMessage());
        }
      } catch (final Exception e) {
        LOGGER.warn("Session {} stopped reading output: {}", id, e.getMessage(), e);
      }
      markClosed();
    };
  }

  private void markClosed() {
    if (closed.compareAndSet(false, true)) {
      LOGGER.debug("Session {} closed", id);
      final SessionOutputListener listener = outputListener;
      if (listener != null) {
        listener.onClosed(id);
      }
    }
  }

  @Override
  public void close() {
    pty.close();
    markClosed();
  }
}
