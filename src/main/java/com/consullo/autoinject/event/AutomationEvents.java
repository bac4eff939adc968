package com.consullo.autoinject.event;

import com.consullo.autoinject.queue.HistoryEntry;
import com.consullo.autoinject.timer.TimerState;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fan-out of automation events to registered listeners.
 *
 * <p>A listener that throws is logged and skipped; it never affects the emitting component or
 * the other listeners.
 *
 * @since 1.0
 */
public final class AutomationEvents {

  private static final Logger LOGGER = LoggerFactory.getLogger(AutomationEvents.class);

  private final List<AutomationEventListener> listeners = new CopyOnWriteArrayList<>();

  public void addListener(final AutomationEventListener listener) {
    Validate.notNull(listener, "listener must not be null");
    this.listeners.add(listener);
  }

  public void removeListener(final AutomationEventListener listener) {
    this.listeners.remove(listener);
  }

  public void action(final ActionEvent event) {
    fire(l -> l.onAction(event));
  }

  public void queueSizeChanged(final int size) {
    fire(l -> l.onQueueSizeChanged(size));
  }

  public void timerStateChanged(final TimerState state) {
    fire(l -> l.onTimerStateChanged(state));
  }

  public void messageInjected(final HistoryEntry entry) {
    fire(l -> l.onMessageInjected(entry));
  }

  private void fire(final Consumer<AutomationEventListener> call) {
    for (final AutomationEventListener l : this.listeners) {
      try {
        call.accept(l);
      } catch (final RuntimeException e) {
        LOGGER.warn("Event listener {} failed: {}", l, e.getMessage(), e);
      }
    }
  }
}
