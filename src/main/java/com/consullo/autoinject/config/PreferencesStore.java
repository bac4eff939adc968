package com.consullo.autoinject.config;

import java.io.IOException;
import java.util.Optional;

/**
 * Storage for {@link Preferences}.
 *
 * @since 1.0
 */
public interface PreferencesStore {

  /**
   * Loads stored preferences.
   *
   * @return preferences, empty if nothing was stored yet
   * @throws IOException if the storage cannot be read
   */
  Optional<Preferences> load() throws IOException;

  void save(Preferences preferences) throws IOException;
}
