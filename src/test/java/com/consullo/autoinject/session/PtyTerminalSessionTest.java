package com.consullo.autoinject.session;

import com.consullo.autoinject.core.jediterm.JediTermCore;
import com.consullo.autoinject.pty.PtyProcessController;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PtyTerminalSession} over an in-memory PTY.
 *
 * @since 1.0
 */
public class PtyTerminalSessionTest {

  private PipedOutputStream ptyWriter;
  private ByteArrayOutputStream ptyInput;
  private PtyProcessController pty;

  @BeforeEach
  void setUp() throws Exception {
    ptyWriter = new PipedOutputStream();
    final PipedInputStream ptyOutput = new PipedInputStream(ptyWriter, 4096);
    ptyInput = new ByteArrayOutputStream();
    pty = mock(PtyProcessController.class);
    when(pty.output()).thenReturn(ptyOutput);
    when(pty.input()).thenReturn(ptyInput);
    when(pty.onExit()).thenReturn(new CompletableFuture<>());
  }

  @Test
  @DisplayName("Should render process output and notify the listener")
  void readLoop_Output_RenderedAndNotified() throws Exception {
    final PtyTerminalSession session = PtyTerminalSession.start(4, pty, new JediTermCore(80, 5, 100));
    final CountDownLatch seen = new CountDownLatch(1);
    session.setOutputListener(id -> {
      if (session.recentOutput(100).contains("ready")) {
        seen.countDown();
      }
    });

    ptyWriter.write("\u001B[32m> ready\u001B[0m".getBytes(StandardCharsets.UTF_8));
    ptyWriter.flush();

    assertThat(seen.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(session.recentOutput(100)).isEqualTo("> ready");
    session.close();
  }

  @Test
  @DisplayName("Should write UTF-8 input and refuse writes after close")
  void write_ThenClose_RefusesFurtherWrites() throws Exception {
    final PtyTerminalSession session = PtyTerminalSession.start(5, pty, new JediTermCore(80, 5, 100));

    session.write("héllo\r");
    assertThat(ptyInput.toString(StandardCharsets.UTF_8)).isEqualTo("héllo\r");

    session.close();
    verify(pty).close();
    assertThatThrownBy(() -> session.write("x")).isInstanceOf(IOException.class);
  }

  @Test
  @DisplayName("Should report closure once when the output stream ends")
  void readLoop_StreamEnds_NotifiesClosedOnce() throws Exception {
    final PtyTerminalSession session = PtyTerminalSession.start(6, pty, new JediTermCore(80, 5, 100));
    final CountDownLatch closed = new CountDownLatch(1);
    final int[] calls = new int[1];
    session.setOutputListener(new SessionOutputListener() {
      @Override
      public void onOutput(final int sessionId) {
      }

      @Override
      public void onClosed(final int sessionId) {
        calls[0]++;
        closed.countDown();
      }
    });

    ptyWriter.close();

    assertThat(closed.await(5, TimeUnit.SECONDS)).isTrue();
    session.close();
    assertThat(calls[0]).isEqualTo(1);
  }
}
