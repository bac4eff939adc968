package com.consullo.autoinject.pty;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on a process attached to a pseudo terminal.
 *
 * @since 1.0
 */
public interface PtyProcessController extends AutoCloseable {

  /**
   * Bytes the process writes to its terminal.
   *
   * @return terminal output
   * @throws IOException if the stream is unavailable
   */
  InputStream output() throws IOException;

  /**
   * Keystrokes delivered to the process.
   *
   * @return terminal input
   * @throws IOException if the stream is unavailable
   */
  OutputStream input() throws IOException;

  void resize(int columns, int rows) throws IOException;

  long pid();

  /**
   * Completes with the exit code once the process has terminated.
   *
   * @return exit future
   */
  CompletableFuture<Integer> onExit();

  boolean isAlive();

  /** Terminates the process if it is still running. */
  @Override
  void close();
}
