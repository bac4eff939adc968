package com.consullo.autoinject.core;

import com.consullo.autoinject.core.jediterm.InMemoryScrollbackView;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ScrollbackView#tailText(int)}.
 *
 * @since 1.0
 */
public class ScrollbackViewTest {

  @Test
  @DisplayName("Should join history and screen, skipping blank rows under the cursor")
  void tailText_HistoryAndScreen_JoinedInOrder() throws Exception {
    final ScrollbackView view = new InMemoryScrollbackView(
        List.of("old 1", "old 2"),
        List.of("screen 1", "screen 2", "", "  "));

    assertThat(view.tailText(1000)).isEqualTo("old 1\nold 2\nscreen 1\nscreen 2");
  }

  @Test
  @DisplayName("Should keep only the trailing characters")
  void tailText_Bounded_KeepsTail() throws Exception {
    final ScrollbackView view = new InMemoryScrollbackView(List.of("abcdef"), List.of("ghij"));

    assertThat(view.tailText(6)).isEqualTo("f\nghij");
  }

  @Test
  @DisplayName("Should walk back through history in chunks")
  void tailText_LongHistory_ReadsAcrossChunks() throws Exception {
    final List<String> history = new ArrayList<>();
    for (int i = 0; i < 100; i++) {
      history.add("line " + i);
    }
    final ScrollbackView view = new InMemoryScrollbackView(history);

    final String tail = view.tailText(400);

    assertThat(tail).endsWith("line 99");
    assertThat(tail.split("\n")).hasSizeGreaterThan(ScrollbackView.TAIL_CHUNK_LINES);
    assertThat(tail).hasSizeLessThanOrEqualTo(400);
  }

  @Test
  @DisplayName("Should return empty text for an empty view and reject non-positive bounds")
  void tailText_EmptyOrInvalid() throws Exception {
    final ScrollbackView view = new InMemoryScrollbackView(List.of());

    assertThat(view.tailText(10)).isEmpty();
    assertThatThrownBy(() -> view.tailText(0)).isInstanceOf(IllegalArgumentException.class);
  }
}
