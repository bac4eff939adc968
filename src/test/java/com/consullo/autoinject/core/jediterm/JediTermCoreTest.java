package com.consullo.autoinject.core.jediterm;

import com.consullo.autoinject.core.TerminalSnapshot;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests of the headless emulation feeding the signal detectors.
 *
 * @since 1.0
 */
public class JediTermCoreTest {

  private static void feed(final JediTermCore core, final String text) {
    final byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    core.feed(bytes, 0, bytes.length);
  }

  @Test
  @DisplayName("Should render lines without colour codes")
  void feed_ColouredLines_PlainText() throws Exception {
    final JediTermCore core = new JediTermCore(80, 5, 100);

    feed(core, "\u001B[31mhello\u001B[0m\r\nworld");

    assertThat(core.recentText(1000)).isEqualTo("hello\nworld");
  }

  @Test
  @DisplayName("Should apply carriage-return rewrites of a line")
  void feed_CarriageReturn_Overwrites() throws Exception {
    final JediTermCore core = new JediTermCore(80, 5, 100);

    feed(core, "spinner |\rspinner /");

    assertThat(core.recentText(1000)).isEqualTo("spinner /");
  }

  @Test
  @DisplayName("Should keep scrolled-off lines in history")
  void feed_MoreLinesThanRows_KeepsHistory() throws Exception {
    final JediTermCore core = new JediTermCore(40, 3, 100);

    feed(core, "one\r\ntwo\r\nthree\r\nfour\r\nfive");

    assertThat(core.scrollback().historyLineCount()).isEqualTo(2);
    assertThat(core.recentText(1000)).isEqualTo("one\ntwo\nthree\nfour\nfive");
  }

  @Test
  @DisplayName("Should notify listeners and decode box characters split across feeds")
  void feed_SplitBoxCorner_RenderedAndNotified() throws Exception {
    final JediTermCore core = new JediTermCore(80, 5, 100);
    final List<TerminalSnapshot> snapshots = new ArrayList<>();
    core.addScreenChangeListener(snapshots::add);
    final byte[] corner = "╭ box".getBytes(StandardCharsets.UTF_8);

    core.feed(corner, 0, 1);
    core.feed(corner, 1, corner.length - 1);

    assertThat(core.recentText(100)).isEqualTo("╭ box");
    assertThat(snapshots).isNotEmpty();
    assertThat(snapshots.get(0).columns()).isEqualTo(80);
  }

  @Test
  @DisplayName("Should report size, capture time and bells in snapshots")
  void snapshot_AfterBellAndResize_ReportsDisplayFacts() throws Exception {
    final Instant now = Instant.parse("2026-01-15T10:30:00Z");
    final JediTermCore core = new JediTermCore(80, 5, 100, Clock.fixed(now, ZoneOffset.UTC));

    feed(core, "done\u0007");
    core.resize(100, 10);

    final TerminalSnapshot snapshot = core.snapshot();
    assertThat(snapshot.capturedAt()).isEqualTo(now);
    assertThat(snapshot.columns()).isEqualTo(100);
    assertThat(snapshot.rows()).isEqualTo(10);
    assertThat(snapshot.bellCount()).isEqualTo(1);
    assertThat(core.recentText(100)).isEqualTo("done");
  }

  @Test
  @DisplayName("Should read a consistent tail while output keeps scrolling")
  void tailText_ConcurrentFeed_LinesStayConsecutive() throws Exception {
    final JediTermCore core = new JediTermCore(40, 4, 50);
    final Thread feeder = new Thread(() -> {
      for (int i = 0; i < 3000; i++) {
        feed(core, "line " + i + "\r\n");
      }
    });
    feeder.start();

    int reads = 0;
    while (feeder.isAlive() || reads == 0) {
      final List<String> lines = new ArrayList<>(List.of(core.scrollback().tailText(120).split("\n")));
      lines.remove(0);
      for (int i = 1; i < lines.size(); i++) {
        final int previous = Integer.parseInt(lines.get(i - 1).substring("line ".length()));
        assertThat(lines.get(i)).isEqualTo("line " + (previous + 1));
      }
      reads++;
    }
    feeder.join();

    assertThat(core.scrollback().tailText(20)).endsWith("line 2999");
  }
}
