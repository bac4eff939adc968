package com.consullo.autoinject.queue;

import java.time.Instant;

/**
 * A delivered message.
 *
 * @param id message id
 * @param content message text
 * @param targetSessionId session it was typed into
 * @param injectedAt time the submit was sent
 * @param originalTimestamp enqueue time
 * @since 1.0
 */
public record HistoryEntry(long id, String content, int targetSessionId, Instant injectedAt, Instant originalTimestamp) {
}
