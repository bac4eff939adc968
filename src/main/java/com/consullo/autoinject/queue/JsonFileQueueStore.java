package com.consullo.autoinject.queue;

import com.consullo.autoinject.config.JsonFiles;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.Validate;

/**
 * {@link QueueStore} keeping the queue as a JSON array in one file.
 *
 * @since 1.0
 */
public final class JsonFileQueueStore implements QueueStore {

  private static final TypeReference<List<Message>> MESSAGE_LIST = new TypeReference<>() {
  };

  private final Path file;
  private final ObjectMapper objectMapper;

  public JsonFileQueueStore(final Path file, final ObjectMapper objectMapper) {
    Validate.notNull(file, "file must not be null");
    Validate.notNull(objectMapper, "objectMapper must not be null");
    this.file = file;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<Message> load() throws IOException {
    if (!Files.exists(this.file)) {
      return List.of();
    }
    final List<Message> messages = this.objectMapper.readValue(this.file.toFile(), MESSAGE_LIST);
    return messages != null ? messages : List.of();
  }

  @Override
  public void save(final List<Message> messages) throws IOException {
    Validate.notNull(messages, "messages must not be null");
    JsonFiles.writeAtomically(this.file, this.objectMapper.writeValueAsBytes(messages));
  }
}
