package io.qzss.dcragent.application.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Partial (substring) keyword matching used by locality filters.
 *
 * <p>Two modes share the same keyword semantics. {@link #matchesAny} decides whether a received report is relevant
 * and succeeds when any keyword occurs in any locality. {@link #matchesAll} validates configuration and requires
 * every keyword to occur in some legal value. A list without non-blank keywords means "no filter" in both modes.</p>
 *
 * @since 0.1.0
 */
public final class KeywordMatcher {
  private KeywordMatcher() {}

  /**
   * Splits a comma separated configuration value into trimmed keywords.
   *
   * @param raw configuration value; may be {@code null}
   * @return keywords in order, blank entries removed
   */
  public static List<String> parseList(String raw) {
    List<String> out = new ArrayList<>();
    if (raw == null) {
      return out;
    }
    for (String part : raw.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        out.add(trimmed);
      }
    }
    return out;
  }

  /**
   * Reports whether the keyword list filters nothing.
   *
   * @param keywords configured keywords
   * @return {@code true} when no keyword is non-blank
   */
  public static boolean isUnfiltered(Collection<String> keywords) {
    if (keywords == null) {
      return true;
    }
    for (String keyword : keywords) {
      if (keyword != null && !keyword.isBlank()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Runtime relevance test (logical OR across keywords).
   *
   * @param keywords configured keywords
   * @param values localities carried by the report
   * @return {@code true} if the list is unfiltered or some keyword is a substring of some value
   */
  public static boolean matchesAny(Collection<String> keywords, Collection<String> values) {
    if (isUnfiltered(keywords)) {
      return true;
    }
    for (String keyword : keywords) {
      if (keyword == null || keyword.isBlank()) {
        continue;
      }
      if (occursIn(keyword.trim(), values)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Configuration validation test (logical AND across keywords).
   *
   * @param keywords configured keywords
   * @param vocabulary every legal value of the field
   * @return {@code true} if the list is unfiltered or every keyword is a substring of some legal value
   */
  public static boolean matchesAll(Collection<String> keywords, Collection<String> vocabulary) {
    if (isUnfiltered(keywords)) {
      return true;
    }
    for (String keyword : keywords) {
      if (keyword == null || keyword.isBlank()) {
        continue;
      }
      if (!occursIn(keyword.trim(), vocabulary)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the keywords that do not occur in any legal value.
   *
   * @param keywords configured keywords
   * @param vocabulary every legal value of the field
   * @return unmatched keywords in configured order
   */
  public static List<String> unmatched(Collection<String> keywords, Collection<String> vocabulary) {
    List<String> out = new ArrayList<>();
    if (keywords == null) {
      return out;
    }
    for (String keyword : keywords) {
      if (keyword == null || keyword.isBlank()) {
        continue;
      }
      String trimmed = keyword.trim();
      if (!occursIn(trimmed, vocabulary)) {
        out.add(trimmed);
      }
    }
    return out;
  }

  private static boolean occursIn(String keyword, Collection<String> values) {
    if (values == null) {
      return false;
    }
    for (String value : values) {
      if (value != null && value.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
