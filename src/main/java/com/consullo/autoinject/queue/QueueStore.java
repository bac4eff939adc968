package com.consullo.autoinject.queue;

import java.io.IOException;
import java.util.List;

/**
 * Storage for the message queue. Saved on every mutation.
 *
 * @since 1.0
 */
public interface QueueStore {

  /** Store that keeps nothing. */
  QueueStore NONE = new QueueStore() {
    @Override
    public List<Message> load() {
      return List.of();
    }

    @Override
    public void save(final List<Message> messages) {
    }
  };

  List<Message> load() throws IOException;

  void save(List<Message> messages) throws IOException;
}
