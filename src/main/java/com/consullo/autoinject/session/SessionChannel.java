package com.consullo.autoinject.session;

import java.io.IOException;

/**
 * Bidirectional text channel to one interactive session.
 *
 * <p>Writes are fire-and-forget: no acknowledgement of terminal-side processing exists.
 *
 * @since 1.0
 */
public interface SessionChannel extends AutoCloseable {

  /** Carriage return, the submit keystroke. */
  String SUBMIT = "\r";

  /**
   * Session id, unique among open sessions.
   *
   * @return id
   */
  int id();

  /**
   * Writes input to the session.
   *
   * @param text text to write
   * @throws IOException if the transport fails
   */
  void write(String text) throws IOException;

  /**
   * Returns up to {@code maxChars} of the most recent output as plain text.
   *
   * @param maxChars bound on returned length
   * @return trailing output, never null
   */
  String recentOutput(int maxChars);

  /**
   * Registers a listener notified when new output arrives.
   *
   * @param listener listener
   */
  void setOutputListener(SessionOutputListener listener);

  @Override
  void close();
}
