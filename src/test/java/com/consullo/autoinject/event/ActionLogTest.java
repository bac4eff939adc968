package com.consullo.autoinject.event;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ActionLog} and {@link AutomationEvents}.
 *
 * @since 1.0
 */
public class ActionLogTest {

  private final Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

  @Test
  @DisplayName("Should retain only the most recent entries")
  void log_OverCapacity_DropsOldest() throws Exception {
    final ActionLog log = new ActionLog(clock, new AutomationEvents(), 3);

    for (int i = 1; i <= 5; i++) {
      log.info("entry " + i);
    }

    assertThat(log.recent()).extracting(ActionEvent::message).containsExactly("entry 3", "entry 4", "entry 5");
    assertThat(log.recent().get(0).timestamp()).isEqualTo(clock.instant());
  }

  @Test
  @DisplayName("Should publish every entry with its level")
  void log_PublishesToListeners() throws Exception {
    final AutomationEvents events = new AutomationEvents();
    final AutomationEventListener listener = mock(AutomationEventListener.class);
    events.addListener(listener);
    final ActionLog log = new ActionLog(clock, events);

    log.success("done");
    log.error("broken");

    verify(listener).onAction(new ActionEvent(clock.instant(), "done", ActionLevel.SUCCESS));
    verify(listener).onAction(new ActionEvent(clock.instant(), "broken", ActionLevel.ERROR));
  }

  @Test
  @DisplayName("Should keep notifying other listeners when one throws")
  void fire_FailingListener_Isolated() throws Exception {
    final AutomationEvents events = new AutomationEvents();
    final AutomationEventListener failing = mock(AutomationEventListener.class);
    final AutomationEventListener healthy = mock(AutomationEventListener.class);
    doThrow(new IllegalStateException("boom")).when(failing).onQueueSizeChanged(anyInt());
    events.addListener(failing);
    events.addListener(healthy);

    events.queueSizeChanged(4);

    verify(healthy).onQueueSizeChanged(4);
    events.removeListener(healthy);
    events.action(new ActionEvent(clock.instant(), "x", ActionLevel.INFO));
    verify(healthy, never()).onAction(any());
  }
}
