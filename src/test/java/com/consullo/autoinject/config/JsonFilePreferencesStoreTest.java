package com.consullo.autoinject.config;

import com.consullo.autoinject.keyword.KeywordRule;
import com.consullo.autoinject.timer.TimerDuration;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonFilePreferencesStore}.
 *
 * @since 1.0
 */
public class JsonFilePreferencesStoreTest {

  @TempDir
  Path tempDir;

  @Test
  @DisplayName("Should read back saved preferences")
  void saveLoad_RoundTrip() throws Exception {
    final JsonFilePreferencesStore store =
        new JsonFilePreferencesStore(tempDir.resolve("prefs.json"), JsonFiles.objectMapper());
    final Preferences prefs = new Preferences(true,
        List.of(new KeywordRule("rm -rf", null, 4), new KeywordRule("deploy", "not yet")),
        45, new TimerDuration(2, 0, 30), 20, Instant.parse("2026-01-15T15:00:00Z"));

    store.save(prefs);

    assertThat(store.load()).contains(prefs);
  }

  @Test
  @DisplayName("Should return nothing when no file exists")
  void load_NoFile_Empty() throws Exception {
    final JsonFilePreferencesStore store =
        new JsonFilePreferencesStore(tempDir.resolve("missing.json"), JsonFiles.objectMapper());

    assertThat(store.load()).isEmpty();
  }

  @Test
  @DisplayName("Should ignore unknown properties and fill defaults for missing ones")
  void load_PartialDocument_DefaultsApplied() throws Exception {
    final Path file = tempDir.resolve("prefs.json");
    Files.writeString(file, "{\"autoContinueEnabled\": true, \"theme\": \"dark\"}");

    final Preferences prefs = new JsonFilePreferencesStore(file, JsonFiles.objectMapper()).load().orElseThrow();

    assertThat(prefs.autoContinueEnabled()).isTrue();
    assertThat(prefs.keywordRules()).isEmpty();
    assertThat(prefs.timerDuration()).isEqualTo(TimerDuration.ZERO);
    assertThat(prefs.maxSafetyCheckAttempts()).isEqualTo(30);
  }
}
