/**
 * Metrics adapters backed by OpenTelemetry.
 * <p><strong>Configuration:</strong> {@code otel.metrics.exporter} ({@code otlp} or {@code none}),
 * {@code otel.exporter.otlp.endpoint} and {@code otel.resource.attributes}, set from the CLI by
 * {@code TelemetryConfigurator} or from the matching {@code OTEL_*} environment variables.</p>
 */
package io.qzss.dcragent.infrastructure.metrics;
