package io.qzss.dcragent.application.pipeline;

import io.qzss.dcragent.application.dedup.DedupCache;
import io.qzss.dcragent.application.dispatch.NotificationDispatcher;
import io.qzss.dcragent.application.filter.CategoryFilterEngine;
import io.qzss.dcragent.application.port.ClockPort;
import io.qzss.dcragent.application.port.MetricsPort;
import io.qzss.dcragent.application.port.ReportHandler;
import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.domain.report.Disposition;
import io.qzss.dcragent.domain.report.Notification;
import io.qzss.dcragent.domain.report.Report;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-report path from decoder callback to notification channels.
 * <p><strong>Why:</strong> Keeps ordering simple: each report is deduplicated, filtered and dispatched before the
 * decoder reads the next one.</p>
 * <p><strong>Role:</strong> {@link ReportHandler} registered with the decoder by {@link ProcessSupervisor}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drop null messages before they reach the cache.</li>
 *   <li>Suppress duplicates via {@link DedupCache}; warn once per window about unknown report kinds.</li>
 *   <li>Evaluate the category filter and dispatch the resulting notification.</li>
 *   <li>Evict expired cache entries after every report.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the supervisor thread.</p>
 * <p><strong>Observability:</strong> Emits {@code agent.report.*} counters and {@code agent.cache.evicted}.</p>
 *
 * @since 0.1.0
 */
public final class ReportPipeline implements ReportHandler {
  private static final Logger log = LoggerFactory.getLogger(ReportPipeline.class);

  private final DedupCache cache;
  private final CategoryFilterEngine filter;
  private final NotificationDispatcher dispatcher;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public ReportPipeline(
      DedupCache cache,
      CategoryFilterEngine filter,
      NotificationDispatcher dispatcher,
      ClockPort clock,
      MetricsPort metrics) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.filter = Objects.requireNonNull(filter, "filter");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void onReport(Report report) {
    Instant now = clock.now();
    metrics.increment("agent.report.received");
    try {
      process(report, now);
    } finally {
      int evicted = cache.evictExpired(now);
      if (evicted > 0) {
        log.debug("Evicted {} expired cache entries", evicted);
        metrics.observe("agent.cache.evicted", evicted);
      }
    }
  }

  private void process(Report report, Instant now) {
    Category category = report.category();
    if (category == Category.NULL) {
      log.debug("Null message dropped");
      metrics.increment("agent.report.dropped.null");
      return;
    }
    if (!cache.lookupOrInsert(report, now)) {
      log.debug("Duplicate {} ignored", category);
      metrics.increment("agent.report.duplicate");
      return;
    }
    if (category == Category.UNKNOWN) {
      log.warn("Unknown report dropped: {}", report.header().isEmpty() ? report.text() : report.header());
      metrics.increment("agent.report.dropped.unknown");
      return;
    }
    log.info("Received {}: {}", category, report.header());

    Optional<Disposition> disposition = filter.evaluate(report);
    if (disposition.isEmpty()) {
      return;
    }
    if (disposition.get().filtered()) {
      metrics.increment("agent.report.filtered");
    }
    dispatcher.dispatch(new Notification(report, disposition.get(), now));
  }
}
