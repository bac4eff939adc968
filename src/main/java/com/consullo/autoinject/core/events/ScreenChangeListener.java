package com.consullo.autoinject.core.events;

import com.consullo.autoinject.core.TerminalSnapshot;

/**
 * Observer of a terminal model.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface ScreenChangeListener {

  /**
   * Invoked on the feeding thread once a chunk of output has been applied.
   *
   * @param snapshot display facts after the chunk
   */
  void onScreenChanged(TerminalSnapshot snapshot);
}
