package com.consullo.autoinject.pty;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.Validate;

/**
 * What to spawn for one session and how big its terminal starts.
 *
 * @param command executable and arguments, e.g. {@code ["claude"]}
 * @param workingDirectory directory the process starts in
 * @param environment complete process environment
 * @param columns initial terminal width
 * @param rows initial terminal height
 * @since 1.0
 */
public record PtyProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    int columns,
    int rows) {

  /** Terminal type advertised to every session. */
  public static final String TERM = "xterm-256color";

  public PtyProcessConfig {
    Validate.notEmpty(command, "command must not be empty");
    Validate.notBlank(command.get(0), "executable must not be blank");
    Validate.notNull(workingDirectory, "workingDirectory must not be null");
    Validate.isTrue(columns > 0, "columns must be positive");
    Validate.isTrue(rows > 0, "rows must be positive");
    command = List.copyOf(command);
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }

  /**
   * Inherits the current process environment, forces {@link #TERM} and optionally sets
   * {@code CI=1} so that tools which honour it skip their animations.
   *
   * @param command executable and arguments
   * @param workingDirectory start directory, or null for the current one
   * @param columns initial width
   * @param rows initial height
   * @param ciMode whether to set {@code CI=1}
   * @return configuration
   */
  public static PtyProcessConfig inheritingEnvironment(
      final List<String> command,
      final Path workingDirectory,
      final int columns,
      final int rows,
      final boolean ciMode) {
    final Map<String, String> env = new LinkedHashMap<>(System.getenv());
    env.put("TERM", TERM);
    if (ciMode) {
      env.put("CI", "1");
    }
    final Path dir = workingDirectory != null
        ? workingDirectory
        : Path.of("").toAbsolutePath().normalize();
    return new PtyProcessConfig(command, dir, env, columns, rows);
  }
}
