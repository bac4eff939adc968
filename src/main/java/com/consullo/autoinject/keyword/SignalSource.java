package com.consullo.autoinject.keyword;

import com.consullo.autoinject.signal.SignalReport;
import java.util.Optional;

/**
 * Fresh classification of a session's current output.
 *
 * @since 1.0
 */
@FunctionalInterface
public interface SignalSource {

  Optional<SignalReport> latest(int sessionId);
}
