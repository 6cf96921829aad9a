package io.qzss.dcragent.application.filter;

import java.util.List;

/**
 * Operator rule for one category.
 *
 * @param enabled {@code use} switch
 * @param keywords locality keywords; empty means no locality filter
 * @since 0.1.0
 */
public record CategoryRule(boolean enabled, List<String> keywords) {

  /** Enabled without locality filter. */
  public static final CategoryRule ALLOW_ALL = new CategoryRule(true, List.of());

  public CategoryRule {
    keywords = keywords == null ? List.of() : List.copyOf(keywords);
  }
}
