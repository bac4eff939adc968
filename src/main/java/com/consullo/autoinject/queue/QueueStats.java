package com.consullo.autoinject.queue;

import java.util.Map;

/**
 * Queue counts.
 *
 * @param total queued messages
 * @param perSession queued messages by target session
 * @param due messages whose execute time has passed
 * @since 1.0
 */
public record QueueStats(int total, Map<Integer, Integer> perSession, int due) {
}
