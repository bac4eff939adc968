package com.consullo.autoinject.event;

import com.consullo.autoinject.queue.HistoryEntry;
import com.consullo.autoinject.timer.TimerState;

/**
 * Receives state changes meant for display (action log, queue size, timer, history).
 *
 * <p>Callbacks run on the automation execution context and must return quickly. All methods
 * default to no-ops so listeners implement only what they render.
 *
 * @since 1.0
 */
public interface AutomationEventListener {

  default void onAction(ActionEvent event) {
  }

  default void onQueueSizeChanged(int size) {
  }

  default void onTimerStateChanged(TimerState state) {
  }

  default void onMessageInjected(HistoryEntry entry) {
  }
}
