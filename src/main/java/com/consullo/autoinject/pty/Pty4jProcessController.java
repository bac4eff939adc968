package com.consullo.autoinject.pty;

import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.concurrent.CompletableFuture;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PtyProcessController} backed by pty4j.
 *
 * @since 1.0
 */
public final class Pty4jProcessController implements PtyProcessController {

  private static final Logger LOGGER = LoggerFactory.getLogger(Pty4jProcessController.class);

  private final PtyProcess process;
  private final CompletableFuture<Integer> exit;

  private Pty4jProcessController(final PtyProcess process) {
    this.process = process;
    this.exit = process.onExit().thenApply(Process::exitValue);
    this.exit.thenAccept(code -> LOGGER.info("Process {} exited with code {}", process.pid(), code));
  }

  /**
   * Spawns the configured command on a fresh pseudo terminal.
   *
   * @param config what to run
   * @return controller for the running process
   * @throws IOException if the process cannot be started
   */
  public static Pty4jProcessController spawn(final PtyProcessConfig config) throws IOException {
    Validate.notNull(config, "config must not be null");
    final PtyProcess process = new PtyProcessBuilder(config.command().toArray(new String[0]))
        .setDirectory(config.workingDirectory().toString())
        .setEnvironment(new HashMap<>(config.environment()))
        .setInitialColumns(config.columns())
        .setInitialRows(config.rows())
        .start();
    LOGGER.info("Spawned {} as pid {} in {} ({}x{})",
        config.command(), process.pid(), config.workingDirectory(), config.columns(), config.rows());
    return new Pty4jProcessController(process);
  }

  @Override
  public InputStream output() {
    return process.getInputStream();
  }

  @Override
  public OutputStream input() {
    return process.getOutputStream();
  }

  @Override
  public void resize(final int columns, final int rows) {
    Validate.isTrue(columns > 0 && rows > 0, "terminal size must be positive: %dx%d", columns, rows);
    process.setWinSize(new WinSize(columns, rows));
  }

  @Override
  public long pid() {
    return process.pid();
  }

  @Override
  public CompletableFuture<Integer> onExit() {
    return exit;
  }

  @Override
  public boolean isAlive() {
    return process.isAlive();
  }

  @Override
  public void close() {
    if (process.isAlive()) {
      LOGGER.debug("Destroying pid {}", process.pid());
      process.destroy();
    }
  }
}
