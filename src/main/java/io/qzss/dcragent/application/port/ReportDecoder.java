package io.qzss.dcragent.application.port;

import io.qzss.dcragent.domain.report.SourceType;
import java.io.IOException;
import java.io.InputStream;

/**
 * <strong>What:</strong> Port turning the producer's output stream into decoded reports.
 * <p><strong>Why:</strong> Keeps the supervisor independent of the wire format emitted by {@code gpsmon} or a
 * pre-decoding producer.</p>
 * <p><strong>Thread-safety:</strong> Invoked from the supervisor thread only.</p>
 *
 * @since 0.1.0
 */
public interface ReportDecoder {
  /**
   * Reads {@code input} until end of stream, handing each report to {@code handler} as it is decoded.
   *
   * @param input producer standard output; not closed by this method
   * @param type format of the stream
   * @param handler report callback
   * @throws IOException if reading the stream fails
   * @throws DecodeException if the stream carries data that cannot be decoded
   */
  void decodeStream(InputStream input, SourceType type, ReportHandler handler)
      throws IOException, DecodeException;
}
