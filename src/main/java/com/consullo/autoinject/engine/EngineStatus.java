package com.consullo.autoinject.engine;

import com.consullo.autoinject.session.SessionView;
import com.consullo.autoinject.timer.TimerState;
import com.consullo.autoinject.usage.UsageLimitRecord;
import java.util.List;

/**
 * Point-in-time summary of the automation state.
 *
 * @param sessions per-session state
 * @param queueSize queued messages
 * @param timer timer state
 * @param injectedCount messages submitted since start
 * @param injectionPaused typing paused
 * @param draining queue being processed
 * @param autoContinueEnabled continuation prompts answered automatically
 * @param usageLimit usage-limit bookkeeping
 * @since 1.0
 */
public record EngineStatus(
    List<SessionView> sessions,
    int queueSize,
    TimerState timer,
    long injectedCount,
    boolean injectionPaused,
    boolean draining,
    boolean autoContinueEnabled,
    UsageLimitRecord usageLimit) {
}
