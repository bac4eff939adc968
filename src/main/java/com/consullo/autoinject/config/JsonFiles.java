package com.consullo.autoinject.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON mapping and atomic file writes shared by the file-backed stores.
 *
 * @since 1.0
 */
public final class JsonFiles {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFiles.class);

  private JsonFiles() {
  }

  /**
   * Mapper with ISO-8601 instants that ignores unknown properties.
   *
   * @return new mapper
   */
  public static ObjectMapper objectMapper() {
    final ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    return mapper;
  }

  /**
   * Replaces {@code target} with {@code bytes}: written to a sibling temp file, then moved over
   * the target.
   *
   * @param target file to replace
   * @param bytes new content
   * @throws IOException if writing or moving fails; the target is then left untouched
   */
  public static void writeAtomically(final Path target, final byte[] bytes) throws IOException {
    Validate.notNull(target, "target must not be null");
    Validate.notNull(bytes, "bytes must not be null");

    final Path dir = target.toAbsolutePath().getParent();
    if (dir != null) {
      Files.createDirectories(dir);
    }
    final Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      Files.write(temp, bytes);
      try {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (final AtomicMoveNotSupportedException e) {
        LOGGER.warn("Atomic move not supported for {}, using regular move", target);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (final IOException e) {
      try {
        Files.deleteIfExists(temp);
      } catch (final IOException cleanup) {
        LOGGER.warn("Failed to clean up temp file {}: {}", temp, cleanup.getMessage());
      }
      throw e;
    }
  }
}
