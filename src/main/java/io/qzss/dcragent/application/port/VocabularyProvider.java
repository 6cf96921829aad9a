package io.qzss.dcragent.application.port;

import io.qzss.dcragent.domain.report.LocalityField;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Supplies the legal values of a locality field for configuration validation.
 *
 * @since 0.1.0
 */
public interface VocabularyProvider {
  /**
   * Returns every legal value of {@code field}.
   *
   * @param field locality field; never {@link LocalityField#NONE}
   * @return values, or empty when no vocabulary is installed for the field
   * @throws IOException if the vocabulary exists but cannot be read
   */
  Optional<List<String>> values(LocalityField field) throws IOException;
}
