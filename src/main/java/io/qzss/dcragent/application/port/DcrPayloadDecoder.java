package io.qzss.dcragent.application.port;

import io.qzss.dcragent.domain.report.LocalityField;
import io.qzss.dcragent.domain.report.Report;
import java.util.List;
import java.util.Optional;

/**
 * Service provider decoding one QZSS L1S disaster/crisis payload into a report.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}; the agent ships none because the
 * JMA/DCX bit-level format is maintained separately. A {@code gpsmon} source without a provider on the
 * classpath is a configuration error.</p>
 *
 * <p>A decoder may also publish its JMA code tables, which validate locality keywords at startup.</p>
 *
 * @since 0.1.0
 */
public interface DcrPayloadDecoder {
  /**
   * Decodes a raw 250-bit L1S message.
   *
   * @param payload message bytes as carried by the u-blox SFRBX frame
   * @return decoded report, or empty when the payload is not a disaster message
   * @throws DecodeException if the payload is malformed
   */
  Optional<Report> decode(byte[] payload) throws DecodeException;

  /**
   * Returns the legal values of a locality field from the decoder's code tables.
   *
   * @param field locality field
   * @return values, or empty when the decoder does not publish this table
   */
  default Optional<List<String>> vocabulary(LocalityField field) {
    return Optional.empty();
  }
}
