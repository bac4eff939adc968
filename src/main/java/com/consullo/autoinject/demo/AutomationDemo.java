package com.consullo.autoinject.demo;

import com.consullo.autoinject.config.AutomationConfig;
import com.consullo.autoinject.config.JsonFilePreferencesStore;
import com.consullo.autoinject.config.JsonFiles;
import com.consullo.autoinject.engine.AutomationEngine;
import com.consullo.autoinject.engine.EngineStatus;
import com.consullo.autoinject.event.ActionEvent;
import com.consullo.autoinject.event.AutomationEventListener;
import com.consullo.autoinject.exec.SingleThreadTaskScheduler;
import com.consullo.autoinject.notify.LoggingNotifier;
import com.consullo.autoinject.queue.JsonFileQueueStore;
import com.consullo.autoinject.session.PtyTerminalSession;
import com.consullo.autoinject.session.TerminalSessionFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that starts a shell in a PTY, queues two messages for it and drains the queue.
 *
 * <p>
 * The shell prompt counts as ready, so both messages are typed into it with human-like pacing.
 * Queue and preferences are kept as JSON under a temporary directory.
 *
 * @since 1.0
 */
public final class AutomationDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(AutomationDemo.class);

  private AutomationDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args optional command to run instead of {@code /bin/bash}
   * @throws Exception if demo fails
   */
  public static void main(final String[] args) throws Exception {
    final List<String> cmd = args.length > 0 ? List.of(args) : List.of("/bin/bash", "--norc", "-i");
    final Path stateDir = Files.createTempDirectory("auto-injector-demo");
    final ObjectMapper mapper = JsonFiles.objectMapper();

    final AutomationConfig config = AutomationConfig.builder()
        .readyStability(Duration.ofMillis(500))
        .build();

    try (SingleThreadTaskScheduler scheduler = new SingleThreadTaskScheduler();
        AutomationEngine engine = AutomationEngine.builder(config, scheduler)
            .queueStore(new JsonFileQueueStore(stateDir.resolve("queue.json"), mapper))
            .preferencesStore(new JsonFilePreferencesStore(stateDir.resolve("preferences.json"), mapper))
            .notifier(new LoggingNotifier())
            .build()) {

      engine.addListener(new AutomationEventListener() {
        @Override
        public void onAction(final ActionEvent event) {
          System.out.println("[" + event.level() + "] " + event.message());
        }
      });
      engine.start().get(5, TimeUnit.SECONDS);

      final TerminalSessionFactory factory = new TerminalSessionFactory(true, 120, 30);
      final PtyTerminalSession session = factory.start(cmd, null);
      LOGGER.info("Started demo session {}", session.id());
      engine.attachSession(session).get(5, TimeUnit.SECONDS);

      engine.submit("echo 'first queued message'", session.id()).get(5, TimeUnit.SECONDS);
      engine.submit("echo 'second queued message'", session.id()).get(5, TimeUnit.SECONDS);
      engine.submit("/usage-limit-status", session.id()).get(5, TimeUnit.SECONDS);
      engine.drainNow().get(5, TimeUnit.SECONDS);

      final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(30);
      EngineStatus status = engine.status().get(5, TimeUnit.SECONDS);
      while ((status.draining() || status.queueSize() > 0) && System.nanoTime() < deadline) {
        Thread.sleep(250);
        status = engine.status().get(5, TimeUnit.SECONDS);
      }

      System.out.println("=== Session output ===");
      System.out.println(session.recentOutput(2000));
      System.out.println("=== " + status.injectedCount() + " messages injected ===");
      engine.closeSession(session.id()).get(5, TimeUnit.SECONDS);
      LOGGER.info("Demo completed");
    }
  }
}
