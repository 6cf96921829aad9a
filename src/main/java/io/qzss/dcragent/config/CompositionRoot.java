package io.qzss.dcragent.config;

import io.qzss.dcragent.application.dedup.DedupCache;
import io.qzss.dcragent.application.dispatch.MailComposer;
import io.qzss.dcragent.application.dispatch.MailNotificationSink;
import io.qzss.dcragent.application.dispatch.NotificationDispatcher;
import io.qzss.dcragent.application.dispatch.ReportFormatter;
import io.qzss.dcragent.application.filter.CategoryFilterEngine;
import io.qzss.dcragent.application.pipeline.CacheCheckpoint;
import io.qzss.dcragent.application.pipeline.ProcessSupervisor;
import io.qzss.dcragent.application.pipeline.ReportPipeline;
import io.qzss.dcragent.application.port.CacheStore;
import io.qzss.dcragent.application.port.ClockPort;
import io.qzss.dcragent.application.port.DcrPayloadDecoder;
import io.qzss.dcragent.application.port.MailSender;
import io.qzss.dcragent.application.port.MetricsPort;
import io.qzss.dcragent.application.port.NotificationSink;
import io.qzss.dcragent.application.port.ProducerLauncher;
import io.qzss.dcragent.application.port.ReportDecoder;
import io.qzss.dcragent.application.port.Sleeper;
import io.qzss.dcragent.application.port.VocabularyProvider;
import io.qzss.dcragent.domain.report.SourceType;
import io.qzss.dcragent.infrastructure.decode.StreamReportDecoder;
import io.qzss.dcragent.infrastructure.json.JsonReportCodec;
import io.qzss.dcragent.infrastructure.mail.JakartaMailSender;
import io.qzss.dcragent.infrastructure.persistence.JsonCacheFileStore;
import io.qzss.dcragent.infrastructure.process.OsProducerLauncher;
import io.qzss.dcragent.infrastructure.sink.ConsoleReportSink;
import io.qzss.dcragent.infrastructure.sink.RollingFileReportSink;
import io.qzss.dcragent.infrastructure.vocabulary.ResourceVocabularyProvider;
import io.qzss.dcragent.validation.Paths;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the agent from one {@link AgentConfig}.
 * <p><strong>Why:</strong> Keeps every collaborator explicit; components receive their dependencies through
 * constructors and never read global state.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the duplicate cache, filter engine, channels and dispatcher.</li>
 *   <li>Discover the L1S payload decoder through {@link ServiceLoader}.</li>
 *   <li>Assemble the supervisor and the cache checkpoint.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; used on the startup thread. Components are created once and
 * memoized.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final AgentConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ZoneId zone;
  private final JsonReportCodec codec = new JsonReportCodec();

  private DedupCache cache;
  private RollingFileReportSink fileSink;
  private List<NotificationSink> sinks;
  private ReportPipeline pipeline;
  private Optional<DcrPayloadDecoder> payloadDecoder;

  public CompositionRoot(AgentConfig config, MetricsPort metrics, ClockPort clock) {
    this(config, metrics, clock, ZoneId.systemDefault());
  }

  public CompositionRoot(AgentConfig config, MetricsPort metrics, ClockPort clock, ZoneId zone) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public AgentConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  public DedupCache dedupCache() {
    if (cache == null) {
      cache = new DedupCache(config.cache().validity());
    }
    return cache;
  }

  public CategoryFilterEngine categoryFilterEngine() {
    return new CategoryFilterEngine(config.categories(), config.ignoreFilterWhenTraining());
  }

  public VocabularyProvider vocabularyProvider() {
    return new ResourceVocabularyProvider(config.vocabularyDirectory(), payloadDecoder());
  }

  /**
   * Builds the enabled notification channels in file, mail, console order.
   *
   * @return enabled channels
   * @throws IllegalArgumentException if the report file location is not writable
   */
  public List<NotificationSink> notificationSinks() {
    if (sinks != null) {
      return sinks;
    }
    List<NotificationSink> built = new ArrayList<>();
    ReportFormatter formatter = new ReportFormatter(zone);
    FileSinkSettings report = config.report();
    if (report.policy().enabled()) {
      Paths.validateWritableFile("report.path", report.path(), true);
      fileSink = new RollingFileReportSink(
          report.path(), report.fileNamePattern(), report.maxHistory(), formatter, report.policy());
      built.add(fileSink);
      log.info("Report file: {}", report.path());
    } else {
      log.info("Report file disabled");
    }
    MailSettings mail = config.mail();
    if (mail.policy().enabled()) {
      built.add(new MailNotificationSink(
          mailSender(), new MailComposer(mail.suppressHeaderFromText(), zone), mail.policy()));
      log.info("Mail notifications to {} via {}:{}", mail.address(), mail.host(), mail.port());
    } else {
      log.info("Mail notifications disabled");
    }
    if (config.console().policy().enabled()) {
      built.add(new ConsoleReportSink(formatter, config.console().policy()));
    }
    sinks = List.copyOf(built);
    return sinks;
  }

  MailSender mailSender() {
    return new JakartaMailSender(config.mail());
  }

  public NotificationDispatcher notificationDispatcher() {
    return new NotificationDispatcher(notificationSinks(), metrics);
  }

  public ReportPipeline reportPipeline() {
    if (pipeline == null) {
      pipeline = new ReportPipeline(
          dedupCache(), categoryFilterEngine(), notificationDispatcher(), clock, metrics);
    }
    return pipeline;
  }

  public Optional<DcrPayloadDecoder> payloadDecoder() {
    if (payloadDecoder == null) {
      payloadDecoder = discoverPayloadDecoder();
    }
    return payloadDecoder;
  }

  /**
   * Locates the L1S payload decoder provider.
   *
   * @return first provider on the classpath, if any
   */
  public static Optional<DcrPayloadDecoder> discoverPayloadDecoder() {
    return ServiceLoader.load(DcrPayloadDecoder.class).findFirst();
  }

  /**
   * Builds the stream decoder for the configured source type.
   *
   * @return decoder
   * @throws IllegalStateException if the source is {@code gpsmon} and no payload decoder is installed
   */
  public ReportDecoder reportDecoder() {
    Optional<DcrPayloadDecoder> payload = payloadDecoder();
    if (config.source().type() == SourceType.GPSMON && payload.isEmpty()) {
      throw new IllegalStateException(
          "source.type=gpsmon needs a " + DcrPayloadDecoder.class.getName()
              + " provider on the classpath; install one or use source.type=jsonl");
    }
    Consumer<String> rawListener = hex -> { };
    if (config.report().rawPackets()) {
      notificationSinks();
      if (fileSink != null) {
        rawListener = fileSink::writeRawPacket;
      }
    }
    return new StreamReportDecoder(payload, codec, rawListener, metrics);
  }

  public ProcessSupervisor processSupervisor() {
    return processSupervisor(new OsProducerLauncher(), Sleeper.SYSTEM);
  }

  ProcessSupervisor processSupervisor(ProducerLauncher launcher, Sleeper sleeper) {
    SourceSettings source = config.source();
    return new ProcessSupervisor(
        launcher,
        source.argv(),
        source.type(),
        reportDecoder(),
        reportPipeline(),
        source.restartDelay(),
        sleeper,
        metrics);
  }

  public CacheStore cacheStore() {
    return new JsonCacheFileStore(config.cache().path(), codec);
  }

  public CacheCheckpoint cacheCheckpoint() {
    return new CacheCheckpoint(cacheStore(), dedupCache(), clock, metrics);
  }

  /**
   * Returns resources to close at shutdown.
   *
   * @return the report file sink and the metrics adapter where they hold resources
   */
  public List<AutoCloseable> closeables() {
    List<AutoCloseable> out = new ArrayList<>();
    if (fileSink != null) {
      out.add(fileSink);
    }
    if (metrics instanceof AutoCloseable closeable) {
      out.add(closeable);
    }
    return out;
  }
}
