package com.consullo.autoinject.inject;

import com.consullo.autoinject.exec.Cancellable;
import com.consullo.autoinject.queue.Message;
import com.consullo.autoinject.session.SessionChannel;

/**
 * One message being typed into one session.
 *
 * <p>Holds the position within the text and the handle of the next pending step, so the
 * injector can cancel it or park it while paused.
 *
 * @since 1.0
 */
final class InjectionTask {

  private final Message message;
  private final SessionChannel channel;
  private final CancellationToken token = new CancellationToken();

  private InjectionStep step = InjectionStep.TYPING;
  private int index;
  private boolean parked;
  private Cancellable pending = Cancellable.NONE;

  InjectionTask(final Message message, final SessionChannel channel) {
    this.message = message;
    this.channel = channel;
  }

  Message message() {
    return message;
  }

  SessionChannel channel() {
    return channel;
  }

  CancellationToken token() {
    return token;
  }

  InjectionStep step() {
    return step;
  }

  void step(final InjectionStep next) {
    this.step = next;
  }

  boolean hasMoreText() {
    return index < message.processedContent().length();
  }

  /**
   * Next character, surrogate pairs kept together.
   *
   * @return text of the next code point
   */
  String nextChunk() {
    final String text = message.processedContent();
    final int end = text.offsetByCodePoints(index, 1);
    final String chunk = text.substring(index, end);
    index = end;
    return chunk;
  }

  boolean isParked() {
    return parked;
  }

  void parked(final boolean value) {
    this.parked = value;
  }

  void pending(final Cancellable handle) {
    this.pending = handle;
  }

  void cancelPending() {
    pending.cancel();
    pending = Cancellable.NONE;
  }
}
