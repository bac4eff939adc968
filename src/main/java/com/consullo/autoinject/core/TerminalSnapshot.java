package com.consullo.autoinject.core;

import java.time.Instant;

/**
 * Display facts of a terminal at one moment, taken after fed bytes were processed.
 *
 * @param capturedAt when the snapshot was taken
 * @param columns screen width
 * @param rows screen height
 * @param cursorColumn cursor column, 1-based as reported by the emulator
 * @param cursorRow cursor row, 1-based as reported by the emulator
 * @param alternateScreen whether a full-screen program switched to the alternate buffer
 * @param windowTitle last title set through OSC, empty when none
 * @param bellCount bells rung since the terminal was created
 * @since 1.0
 */
public record TerminalSnapshot(
    Instant capturedAt,
    int columns,
    int rows,
    int cursorColumn,
    int cursorRow,
    boolean alternateScreen,
    String windowTitle,
    int bellCount) {
}
