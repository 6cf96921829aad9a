package io.qzss.dcragent.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.qzss.dcragent.application.port.MetricsPort;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter forwarding agent counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily per metric key; keys are lower-cased and stripped of characters OpenTelemetry
 * rejects.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("agent.metric.key");
  private static final String FALLBACK_METRIC_NAME = "agent.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter selected by {@code otel.metrics.exporter}.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  /**
   * Indicates whether updates are discarded because no exporter is configured.
   *
   * @return {@code true} in noop mode
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument =
        counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    instrument.value().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    instrument.value().record(value, instrument.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes pending exports and shuts the meter provider down. */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Instrument<LongCounter> createCounter(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("Agent counter for " + key)
        .build();
    return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Instrument<LongHistogram> createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("Agent observation for " + key)
        .build();
    return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Instrument<T>(T value, Attributes attributes) {}
}
