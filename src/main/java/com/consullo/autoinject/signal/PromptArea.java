package com.consullo.autoinject.signal;

/**
 * Text of the most recent prompt box, the region checked for keywords and continuation prompts.
 *
 * @param text text from the last box marker to the end of the window
 * @param fromMarker false when the area is the fallback tail of the window
 * @since 1.0
 */
public record PromptArea(String text, boolean fromMarker) {
}
