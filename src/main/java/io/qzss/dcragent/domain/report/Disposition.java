package io.qzss.dcragent.domain.report;

/**
 * Outcome of category filtering shared by every notification channel.
 *
 * <p>The three flags are independent; each channel decides on its own which of them it tolerates.</p>
 *
 * @param filtered report failed the category switch or its locality keywords
 * @param training report announces a drill
 * @param incomplete report is a partial multi-part transmission
 * @since 0.1.0
 */
public record Disposition(boolean filtered, boolean training, boolean incomplete) {

  /** Report passed every rule. */
  public static final Disposition ACCEPTED = new Disposition(false, false, false);
}
