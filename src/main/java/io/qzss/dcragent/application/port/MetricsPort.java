package io.qzss.dcragent.application.port;

/**
 * <strong>What:</strong> Port abstracting agent metrics emission.
 * <p><strong>Why:</strong> Lets the pipeline count receptions, suppressions and deliveries without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}, which discards updates when the
 * exporter is {@code none}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept updates from the supervisor thread and the shutdown
 * hook concurrently.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code agent.report.duplicate}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code agent.dispatch.mail.failed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
