package com.consullo.autoinject.queue;

import com.consullo.autoinject.config.JsonFiles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonFileQueueStore}.
 *
 * @since 1.0
 */
public class JsonFileQueueStoreTest {

  @TempDir
  Path tempDir;

  @Test
  @DisplayName("Should read back what it saved, including flags and attachments")
  void saveLoad_MessagesSurviveRestart() throws Exception {
    final Path file = tempDir.resolve("state").resolve("queue.json");
    final JsonFileQueueStore store = new JsonFileQueueStore(file, JsonFiles.objectMapper());
    final Instant t = Instant.parse("2026-01-15T10:00:00Z");
    final Message plain = new Message(1, "hello\nworld", null, 2, t, t.plusSeconds(5), 1, null, null);
    final Message flagged = new Message(2, "continue", null, 3, t, t, 2, Set.of(MessageFlag.AUTO_CONTINUE),
        List.of(Attachment.of("/tmp/shot.png")));

    store.save(List.of(plain, flagged));

    assertThat(Files.readString(file)).contains("2026-01-15T10:00:05Z");
    assertThat(Files.exists(file.resolveSibling("queue.json.tmp"))).isFalse();
    final List<Message> loaded = store.load();
    assertThat(loaded).containsExactly(plain, flagged);
    assertThat(loaded.get(1).hasFlag(MessageFlag.AUTO_CONTINUE)).isTrue();
    assertThat(loaded.get(1).processedContent()).isEqualTo("'/tmp/shot.png' continue");
  }

  @Test
  @DisplayName("Should return an empty queue when the file does not exist")
  void load_MissingFile_Empty() throws Exception {
    final JsonFileQueueStore store = new JsonFileQueueStore(tempDir.resolve("none.json"), JsonFiles.objectMapper());

    assertThat(store.load()).isEmpty();
  }

  @Test
  @DisplayName("Should fail loudly on a corrupt file")
  void load_CorruptFile_Throws() throws Exception {
    final Path file = tempDir.resolve("queue.json");
    Files.writeString(file, "[{oops");
    final JsonFileQueueStore store = new JsonFileQueueStore(file, JsonFiles.objectMapper());

    assertThatThrownBy(store::load).isInstanceOf(java.io.IOException.class);
  }
}
