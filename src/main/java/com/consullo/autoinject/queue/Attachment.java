package com.consullo.autoinject.queue;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.lang3.Validate;

/**
 * A file referenced by a message. Its path is typed ahead of the message text.
 *
 * @param path file path as it should appear to the target program
 * @param image true for image files, which are listed first
 * @since 1.0
 */
public record Attachment(String path, boolean image) {

  private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif", "webp", "bmp", "svg");

  public Attachment {
    Validate.notBlank(path, "path must not be blank");
  }

  /**
   * Creates an attachment, classifying it as an image by file extension.
   *
   * @param path file path
   * @return attachment
   */
  public static Attachment of(final String path) {
    Validate.notBlank(path, "path must not be blank");
    final int dot = path.lastIndexOf('.');
    final String ext = dot >= 0 ? path.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    return new Attachment(path, IMAGE_EXTENSIONS.contains(ext));
  }

  /**
   * Single-quoted path, embedded quotes escaped the POSIX shell way.
   *
   * @return quoted path
   */
  @JsonIgnore
  public String quoted() {
    return "'" + path.replace("'", "'\\''") + "'";
  }
}
