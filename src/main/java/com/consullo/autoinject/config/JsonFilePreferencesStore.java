package com.consullo.autoinject.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * {@link PreferencesStore} keeping one JSON document on disk.
 *
 * @since 1.0
 */
public final class JsonFilePreferencesStore implements PreferencesStore {

  private final Path file;
  private final ObjectMapper objectMapper;

  public JsonFilePreferencesStore(final Path file, final ObjectMapper objectMapper) {
    Validate.notNull(file, "file must not be null");
    Validate.notNull(objectMapper, "objectMapper must not be null");
    this.file = file;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<Preferences> load() throws IOException {
    if (!Files.exists(this.file)) {
      return Optional.empty();
    }
    return Optional.ofNullable(this.objectMapper.readValue(this.file.toFile(), Preferences.class));
  }

  @Override
  public void save(final Preferences preferences) throws IOException {
    Validate.notNull(preferences, "preferences must not be null");
    JsonFiles.writeAtomically(this.file,
        this.objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(preferences));
  }
}
