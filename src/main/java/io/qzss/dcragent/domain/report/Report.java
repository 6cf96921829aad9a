package io.qzss.dcragent.domain.report;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded disaster report as handed over by a decoder.
 *
 * <p>Equality is structural over every component and doubles as the duplicate-suppression key, so two
 * broadcasts of the same report compare equal even when they arrive minutes apart.</p>
 *
 * @param category report kind
 * @param timestamp event time carried by the report; {@code null} when the category has none
 * @param header headline used as the mail subject for JMA reports; never {@code null}
 * @param text human readable rendering of the whole report; never {@code null}
 * @param classification JMA report classification number; {@value #TRAINING_CLASSIFICATION} marks a drill
 * @param trainingFlag drill indicator carried by extended messages
 * @param completed completeness flag of multi-part reports; {@code null} when not applicable
 * @param localities region, prefecture or local-government names used for keyword filtering
 * @since 0.1.0
 */
public record Report(
    Category category,
    Instant timestamp,
    String header,
    String text,
    int classification,
    boolean trainingFlag,
    Boolean completed,
    List<String> localities) {

  /** JMA classification number used for drills and tests. */
  public static final int TRAINING_CLASSIFICATION = 7;

  public Report {
    Objects.requireNonNull(category, "category");
    header = header == null ? "" : header;
    text = text == null ? "" : text;
    localities = localities == null ? List.of() : List.copyOf(localities);
  }

  /**
   * Creates a report without classification, drill flag or completeness information.
   *
   * @param category report kind
   * @param header headline
   * @param text rendering
   * @param localities locality values
   * @return new report
   */
  public static Report of(Category category, String header, String text, List<String> localities) {
    return new Report(category, null, header, text, 0, false, null, localities);
  }

  /**
   * Returns the embedded event time, if any.
   *
   * @return optional event timestamp
   */
  public Optional<Instant> eventTime() {
    return Optional.ofNullable(timestamp);
  }

  /**
   * Indicates whether the report announces a drill rather than a real event.
   *
   * @return {@code true} for classification {@value #TRAINING_CLASSIFICATION} or a set drill flag
   */
  public boolean training() {
    return classification == TRAINING_CLASSIFICATION || trainingFlag;
  }
}
