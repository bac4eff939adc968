package com.consullo.autoinject.keyword;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.apache.commons.lang3.Validate;

/**
 * A keyword that, when seen in a prompt area, blocks auto-continue and sends a canned response.
 *
 * @param keyword text matched case-insensitively
 * @param response text typed in reply, or null to answer with a bare submit
 * @param timesTriggered number of times the rule fired
 * @since 1.0
 */
public record KeywordRule(String keyword, String response, int timesTriggered) {

  public KeywordRule {
    Validate.notBlank(keyword, "keyword must not be blank");
    Validate.isTrue(timesTriggered >= 0, "timesTriggered must not be negative");
    keyword = keyword.trim();
  }

  public KeywordRule(final String keyword, final String response) {
    this(keyword, response, 0);
  }

  /**
   * Rules without a response type nothing and only submit.
   *
   * @return true for escape-only rules, which answer with a bare submit
   */
  @JsonIgnore
  public boolean isEscapeOnly() {
    return response == null;
  }

  public KeywordRule withResponse(final String newResponse) {
    return new KeywordRule(keyword, newResponse, timesTriggered);
  }

  KeywordRule triggered() {
    return new KeywordRule(keyword, response, timesTriggered + 1);
  }

  boolean sameKeyword(final String other) {
    return other != null && keyword.equalsIgnoreCase(other.trim());
  }
}
