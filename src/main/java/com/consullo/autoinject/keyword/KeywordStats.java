package com.consullo.autoinject.keyword;

import java.util.Optional;

/**
 * Trigger statistics over all keyword rules.
 *
 * @param ruleCount number of rules
 * @param totalTriggers sum of all trigger counters
 * @param mostTriggered rule with the highest counter, absent when nothing fired yet
 * @since 1.0
 */
public record KeywordStats(int ruleCount, int totalTriggers, Optional<KeywordRule> mostTriggered) {
}
