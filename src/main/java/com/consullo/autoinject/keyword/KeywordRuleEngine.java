package com.consullo.autoinject.keyword;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered table of keyword rules.
 *
 * <p>Order is the match priority used by the detector. Every change is reported to the change
 * listener so the table can be persisted. Confined to the automation execution context.
 *
 * @since 1.0
 */
public final class KeywordRuleEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeywordRuleEngine.class);

  private static final TypeReference<List<KeywordRule>> RULE_LIST = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;
  private final List<KeywordRule> rules = new ArrayList<>();
  private Consumer<List<KeywordRule>> changeListener = r -> {
  };

  public KeywordRuleEngine(final ObjectMapper objectMapper, final List<KeywordRule> initial) {
    Validate.notNull(objectMapper, "objectMapper must not be null");
    this.objectMapper = objectMapper;
    if (initial != null) {
      for (final KeywordRule rule : initial) {
        if (find(rule.keyword()).isEmpty()) {
          this.rules.add(rule);
        }
      }
    }
  }

  public void setChangeListener(final Consumer<List<KeywordRule>> listener) {
    Validate.notNull(listener, "listener must not be null");
    this.changeListener = listener;
  }

  /**
   * Returns the rules in priority order.
   *
   * @return immutable copy
   */
  public List<KeywordRule> rules() {
    return List.copyOf(this.rules);
  }

  public Optional<KeywordRule> find(final String keyword) {
    return this.rules.stream().filter(r -> r.sameKeyword(keyword)).findFirst();
  }

  /**
   * Appends a rule.
   *
   * @param keyword keyword, not blank and not already present (case-insensitive)
   * @param response response text, or null for escape-only
   * @return the new rule
   * @throws IllegalArgumentException if the keyword is blank or a duplicate
   */
  public KeywordRule add(final String keyword, final String response) {
    Validate.notBlank(keyword, "keyword must not be blank");
    Validate.isTrue(find(keyword).isEmpty(), "keyword already exists: %s", keyword.trim());
    final KeywordRule rule = new KeywordRule(keyword, response);
    this.rules.add(rule);
    LOGGER.info("Added keyword rule '{}'", rule.keyword());
    changed();
    return rule;
  }

  public boolean remove(final String keyword) {
    final boolean removed = this.rules.removeIf(r -> r.sameKeyword(keyword));
    if (removed) {
      LOGGER.info("Removed keyword rule '{}'", keyword);
      changed();
    }
    return removed;
  }

  /**
   * Replaces the response of an existing rule.
   *
   * @param keyword keyword of the rule
   * @param response new response, or null for escape-only
   * @return true if the rule exists
   */
  public boolean updateResponse(final String keyword, final String response) {
    final int index = indexOf(keyword);
    if (index < 0) {
      return false;
    }
    this.rules.set(index, this.rules.get(index).withResponse(response));
    changed();
    return true;
  }

  /**
   * Increments the trigger counter of a rule.
   *
   * @param keyword keyword of the rule that fired
   * @return new counter value, or 0 when the rule no longer exists
   */
  public int recordTrigger(final String keyword) {
    final int index = indexOf(keyword);
    if (index < 0) {
      return 0;
    }
    final KeywordRule updated = this.rules.get(index).triggered();
    this.rules.set(index, updated);
    changed();
    return updated.timesTriggered();
  }

  public void resetCounters() {
    this.rules.replaceAll(r -> new KeywordRule(r.keyword(), r.response(), 0));
    changed();
  }

  public KeywordStats stats() {
    int total = 0;
    KeywordRule top = null;
    for (final KeywordRule r : this.rules) {
      total += r.timesTriggered();
      if (r.timesTriggered() > 0 && (top == null || r.timesTriggered() > top.timesTriggered())) {
        top = r;
      }
    }
    return new KeywordStats(this.rules.size(), total, Optional.ofNullable(top));
  }

  /**
   * Serializes the table as a JSON array.
   *
   * @return JSON text
   * @throws IOException if serialization fails
   */
  public String exportJson() throws IOException {
    return this.objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(this.rules);
  }

  /**
   * Reads rules from a JSON array. Keywords already present are skipped unless {@code replace}
   * is set, in which case the whole table is replaced.
   *
   * @param json JSON array of rules
   * @param replace true to discard the current table first
   * @return number of rules added
   * @throws IOException if the text is not a valid rule list
   */
  public int importJson(final String json, final boolean replace) throws IOException {
    Validate.notNull(json, "json must not be null");
    final List<KeywordRule> imported;
    try {
      imported = this.objectMapper.readValue(json, RULE_LIST);
    } catch (final IllegalArgumentException e) {
      throw new IOException("Invalid keyword rule: " + e.getMessage(), e);
    }
    if (imported == null) {
      throw new IOException("Keyword rule list is empty");
    }
    if (replace) {
      this.rules.clear();
    }
    int added = 0;
    for (final KeywordRule rule : imported) {
      if (rule != null && find(rule.keyword()).isEmpty()) {
        this.rules.add(rule);
        added++;
      }
    }
    LOGGER.info("Imported {} keyword rules", added);
    changed();
    return added;
  }

  private int indexOf(final String keyword) {
    for (int i = 0; i < this.rules.size(); i++) {
      if (this.rules.get(i).sameKeyword(keyword)) {
        return i;
      }
    }
    return -1;
  }

  private void changed() {
    try {
      this.changeListener.accept(rules());
    } catch (final RuntimeException e) {
      LOGGER.warn("Keyword rule change listener failed: {}", e.getMessage(), e);
    }
  }
}
