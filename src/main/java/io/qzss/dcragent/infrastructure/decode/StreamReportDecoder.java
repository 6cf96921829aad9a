package io.qzss.dcragent.infrastructure.decode;

import io.qzss.dcragent.application.port.DcrPayloadDecoder;
import io.qzss.dcragent.application.port.MetricsPort;
import io.qzss.dcragent.application.port.DecodeException;
import io.qzss.dcragent.application.port.ReportDecoder;
import io.qzss.dcragent.application.port.ReportHandler;
import io.qzss.dcragent.domain.report.Report;
import io.qzss.dcragent.domain.report.SourceType;
import io.qzss.dcragent.infrastructure.json.JsonReportCodec;
import io.qzss.dcragent.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Line-oriented {@link ReportDecoder} for {@code gpsmon -a} dumps and JSON-lines producers.
 * <p><strong>Why:</strong> {@code gpsmon} interleaves hex packets from every constellation with JSON status lines;
 * only QZSS L1S subframes carry disaster reports.</p>
 * <p><strong>Role:</strong> Infrastructure adapter driven by {@code ProcessSupervisor}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select u-blox UBX-RXM-SFRBX frames for QZSS and hand their bytes to the {@link DcrPayloadDecoder}.</li>
 *   <li>Skip packets the payload decoder rejects or fails on; single corrupt subframes are routine on L1S.</li>
 *   <li>Log gpsmon status objects.</li>
 *   <li>Parse pre-decoded reports from {@code jsonl} producers, failing on malformed lines.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless per call; used from the supervisor thread.</p>
 *
 * @since 0.1.0
 */
public final class StreamReportDecoder implements ReportDecoder {
  private static final Logger log = LoggerFactory.getLogger(StreamReportDecoder.class);

  static final Pattern GPSMON_PACKET = Pattern.compile("^\\(([0-9]+)\\) ([0-9a-f]+)$");
  static final Pattern GPSMON_JSON = Pattern.compile("^\\(([0-9]+)\\) (\\{.*\\})$");
  static final Pattern UBLOX_SFRBX_QZSS = Pattern.compile("^b5620213(..)0005(..)");

  private static final int LOG_PREVIEW_CHARS = 96;

  private final DcrPayloadDecoder payloadDecoder;
  private final JsonReportCodec codec;
  private final Consumer<String> rawPacketListener;
  private final MetricsPort metrics;

  /**
   * Creates a decoder.
   *
   * @param payloadDecoder L1S payload decoder; required for {@link SourceType#GPSMON}
   * @param codec JSON codec for status lines and {@code jsonl} reports
   * @param rawPacketListener receives every QZSS SFRBX packet as hex before decoding
   * @param metrics counts packets the payload decoder rejects
   */
  public StreamReportDecoder(
      Optional<DcrPayloadDecoder> payloadDecoder,
      JsonReportCodec codec,
      Consumer<String> rawPacketListener,
      MetricsPort metrics) {
    this.payloadDecoder = Objects.requireNonNull(payloadDecoder, "payloadDecoder").orElse(null);
    this.codec = Objects.requireNonNull(codec, "codec");
    this.rawPacketListener = Objects.requireNonNull(rawPacketListener, "rawPacketListener");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void decodeStream(InputStream input, SourceType type, ReportHandler handler)
      throws IOException, DecodeException {
    Objects.requireNonNull(handler, "handler");
    if (type == SourceType.GPSMON && payloadDecoder == null) {
      throw new DecodeException("gpsmon source requires a DcrPayloadDecoder on the classpath");
    }
    BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
    String line;
    while ((line = reader.readLine()) != null) {
      line = line.strip();
      if (line.isEmpty()) {
        continue;
      }
      switch (type) {
        case GPSMON -> decodeGpsmonLine(line, handler);
        case JSONL -> decodeJsonLine(line, handler);
        default -> throw new IllegalStateException("Unsupported source type " + type);
      }
    }
  }

  private void decodeGpsmonLine(String line, ReportHandler handler) {
    Matcher packet = GPSMON_PACKET.matcher(line);
    if (packet.matches()) {
      decodePacket(packet.group(2)).ifPresent(handler::onReport);
      return;
    }
    Matcher status = GPSMON_JSON.matcher(line);
    if (status.matches()) {
      logStatus(status.group(2));
      return;
    }
    log.trace("Ignoring gpsmon line: {}", Logs.truncate(line, LOG_PREVIEW_CHARS));
  }

  private Optional<Report> decodePacket(String hex) {
    if (!UBLOX_SFRBX_QZSS.matcher(hex).lookingAt()) {
      return Optional.empty();
    }
    rawPacketListener.accept(hex);
    byte[] bytes;
    try {
      bytes = HexFormat.of().parseHex(hex);
    } catch (IllegalArgumentException ex) {
      log.debug("Odd-length packet skipped: {}", Logs.truncate(hex, LOG_PREVIEW_CHARS));
      return Optional.empty();
    }
    try {
      return payloadDecoder.decode(bytes);
    } catch (DecodeException ex) {
      log.debug("Undecodable QZSS packet skipped: {} ({})", Logs.hex(bytes, LOG_PREVIEW_CHARS),
          ex.getMessage());
      metrics.increment("agent.decode.packet.rejected");
      return Optional.empty();
    } catch (RuntimeException ex) {
      log.warn("Payload decoder failed on QZSS packet {}; skipped", Logs.hex(bytes, LOG_PREVIEW_CHARS), ex);
      metrics.increment("agent.decode.packet.error");
      return Optional.empty();
    }
  }

  private void logStatus(String json) {
    try {
      log.info("gpsmon info: {}", codec.parse(json));
    } catch (IllegalArgumentException ex) {
      log.info("gpsmon info(raw): {}", json);
    }
  }

  private void decodeJsonLine(String line, ReportHandler handler) throws DecodeException {
    Report report;
    try {
      report = codec.parseReport(line, false);
    } catch (IllegalArgumentException ex) {
      throw new DecodeException("Malformed report line: " + Logs.truncate(line, LOG_PREVIEW_CHARS), ex);
    }
    handler.onReport(report);
  }
}
