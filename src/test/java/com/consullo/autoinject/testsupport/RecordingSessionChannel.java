package com.consullo.autoinject.testsupport;

import com.consullo.autoinject.session.SessionChannel;
import com.consullo.autoinject.session.SessionOutputListener;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Session channel that records writes and serves scripted output.
 */
public final class RecordingSessionChannel implements SessionChannel {

  private final int id;
  private final List<String> writes = new ArrayList<>();
  private String output = "";
  private boolean failWrites;
  private boolean closed;
  private SessionOutputListener listener;

  public RecordingSessionChannel(final int id) {
    this.id = id;
  }

  @Override
  public int id() {
    return id;
  }

  @Override
  public void write(final String text) throws IOException {
    if (failWrites) {
      throw new IOException("write refused");
    }
    writes.add(text);
  }

  @Override
  public String recentOutput(final int maxChars) {
    return output.length() <= maxChars ? output : output.substring(output.length() - maxChars);
  }

  @Override
  public void setOutputListener(final SessionOutputListener listener) {
    this.listener = listener;
  }

  @Override
  public void close() {
    closed = true;
  }

  /**
   * Replaces the current output and notifies the listener, as the transport would.
   *
   * @param text new output
   */
  public void emit(final String text) {
    this.output = text;
    if (listener != null) {
      listener.onOutput(id);
    }
  }

  public void setOutput(final String text) {
    this.output = text;
  }

  public void failWrites(final boolean fail) {
    this.failWrites = fail;
  }

  public List<String> writes() {
    return writes;
  }

  /**
   * Everything written, concatenated.
   *
   * @return written text
   */
  public String written() {
    return String.join("", writes);
  }

  public boolean isClosed() {
    return closed;
  }

  public SessionOutputListener listener() {
    return listener;
  }
}
