package io.qzss.dcragent.api;

import io.qzss.dcragent.application.filter.CategoryRule;
import io.qzss.dcragent.application.pipeline.CacheCheckpoint;
import io.qzss.dcragent.application.pipeline.ProcessSupervisor;
import io.qzss.dcragent.application.pipeline.ProducerSpawnException;
import io.qzss.dcragent.application.port.ClockPort;
import io.qzss.dcragent.application.port.MetricsPort;
import io.qzss.dcragent.config.AgentConfig;
import io.qzss.dcragent.config.CompositionRoot;
import io.qzss.dcragent.config.ConfigMerger;
import io.qzss.dcragent.config.ConfigValidator;
import io.qzss.dcragent.config.YamlConfigLoader;
import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.infrastructure.exec.ShutdownCoordinator;
import io.qzss.dcragent.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.qzss.dcragent.infrastructure.time.SystemClockAdapter;
import io.qzss.dcragent.infrastructure.vocabulary.ResourceVocabularyProvider;
import io.qzss.dcragent.logging.LoggingConfigurator;
import io.qzss.dcragent.logging.Logs;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads configuration, validates it and runs the agent until it is terminated.
 *
 * @since 0.1.0
 */
public final class AgentCli {
  private static final Logger log = LoggerFactory.getLogger(AgentCli.class);
  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);
  private static final String SUMMARY_USAGE =
      "usage: qzss-dcr-agent [-c PATH | config=PATH] [-r PATH | report=PATH] [cache=PATH] [-n | --no-report] "
          + "[--no-load-cache] [--no-dump-cache] [--dry-run] [-l LEVEL | logLevel=LEVEL] [section.key=value ...]";
  private static final String HELP_TEXT = """
      QZSS DC Report agent

      Usage:
        qzss-dcr-agent [options] [section.key=value ...]

      Options:
        -c PATH, config=PATH      YAML configuration file (default /etc/qzssdcragent.yaml)
        -r PATH, report=PATH      Report file (same as report.path=PATH)
        cache=PATH                Cache dump file (same as cache.path=PATH)
        -n, --no-report           Do not write the report file
        --no-load-cache           Start with an empty duplicate cache
        --no-dump-cache           Do not write the cache dump on termination
        --dry-run                 Validate configuration and print the plan without starting the producer
        -l LEVEL, logLevel=LEVEL  Root log level (TRACE, DEBUG, INFO, WARN, ERROR)
        metricsExporter=otlp|none Configure metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        section.key=value         Override any configuration key, e.g. tsunami.regions=伊勢・三河湾
        -v, --verbose             Enable DEBUG logging for troubleshooting
        -h, --help                Show this message
      """;

  private AgentCli() {}

  /**
   * Runs the agent with usage text and the dry-run plan written to stdout.
   *
   * @param args raw CLI arguments
   * @return exit code; {@link ExitCode#TERMINATED} once a termination signal stopped the supervisor
   */
  static ExitCode run(String[] args) {
    PrintWriter stdout = new PrintWriter(
        new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
    return run(args, stdout);
  }

  /**
   * Runs the agent.
   *
   * <p>Operator logs go to stderr through Logback; {@code out} carries only usage text and the dry-run plan.</p>
   *
   * @param args raw CLI arguments
   * @param out destination of usage text and the dry-run plan
   * @return exit code
   */
  static ExitCode run(String[] args, PrintWriter out) {
    AgentArgs input;
    try {
      input = AgentArgs.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      out.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      out.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }

    Map<String, String> kv;
    Path configPath;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs().toArray(String[]::new));
      String level = kv.remove("logLevel");
      if (level != null && !level.isBlank()) {
        LoggingConfigurator.setRootLevel(level);
      }
      TelemetryConfigurator.configureMetrics(kv);
      configPath = ConfigCliUtils.extractConfigPath(kv);
      ConfigCliUtils.applyShortcuts(kv, input);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      out.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    AgentConfig config;
    try {
      Optional<Map<String, String>> yaml = YamlConfigLoader.load(configPath);
      if (yaml.isEmpty()) {
        log.warn("Config file {} not found; using defaults", configPath);
      } else {
        log.info("Loaded config file {}", configPath);
      }
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(yaml, kv, AgentConfig.defaults(), log::warn);
      config = AgentConfig.fromMap(effective);
    } catch (IOException ex) {
      log.error("Unable to read config file {}: {}", configPath, ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    List<ConfigValidator.Failure> failures =
        ConfigValidator.validate(config, new ResourceVocabularyProvider(
            config.vocabularyDirectory(), CompositionRoot.discoverPayloadDecoder()));
    if (!failures.isEmpty()) {
      log.error("Configuration check failed for {} categor{}", failures.size(), failures.size() == 1 ? "y" : "ies");
      return ExitCode.CONFIG_ERROR;
    }

    if (input.dryRun()) {
      printDryRunPlan(config, configPath, out);
      return ExitCode.SUCCESS;
    }
    return runAgent(config);
  }

  private static ExitCode runAgent(AgentConfig config) {
    MetricsPort metrics = new OpenTelemetryMetricsAdapter();
    ClockPort clock = new SystemClockAdapter();
    CompositionRoot root = new CompositionRoot(config, metrics, clock);

    ProcessSupervisor supervisor;
    CacheCheckpoint checkpoint;
    try {
      supervisor = root.processSupervisor();
      checkpoint = root.cacheCheckpoint();
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      closeQuietly(root.closeables());
      return ExitCode.CONFIG_ERROR;
    }

    if (config.cache().load()) {
      checkpoint.restore();
    }
    ShutdownCoordinator coordinator = new ShutdownCoordinator(
        supervisor,
        config.cache().dump() ? Optional.of(checkpoint) : Optional.empty(),
        root.closeables(),
        STOP_TIMEOUT,
        ExitCode.TERMINATED.code(),
        Runtime.getRuntime()::halt);
    coordinator.install();
    return supervise(supervisor, coordinator, root.closeables());
  }

  /**
   * Runs the supervisor loop on the calling thread and maps how it ended to an exit code.
   *
   * @param supervisor supervisor to run
   * @param coordinator installed shutdown hook; disarmed unless a termination signal ended the loop
   * @param closeables resources closed when the hook is disarmed
   * @return {@link ExitCode#TERMINATED} after a stop request, {@link ExitCode#INTERRUPTED} when the thread was
   *     interrupted without one, otherwise the failure's exit code
   */
  static ExitCode supervise(
      ProcessSupervisor supervisor, ShutdownCoordinator coordinator, List<AutoCloseable> closeables) {
    try {
      supervisor.run();
      if (supervisor.stopRequested()) {
        return ExitCode.TERMINATED;
      }
      coordinator.disarm();
      closeQuietly(closeables);
      if (Thread.interrupted()) {
        log.warn("Supervisor interrupted; exiting without cache dump");
        return ExitCode.INTERRUPTED;
      }
      return ExitCode.SUCCESS;
    } catch (ProducerSpawnException ex) {
      coordinator.disarm();
      log.error("{}", ex.getMessage(), ex.getCause());
      closeQuietly(closeables);
      return ExitCode.SPAWN_FAILURE;
    } catch (RuntimeException ex) {
      if (coordinator.disarm()) {
        log.error("Unexpected runtime failure in agent", ex);
        closeQuietly(closeables);
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.TERMINATED;
    }
  }

  private static void closeQuietly(List<AutoCloseable> resources) {
    for (AutoCloseable resource : resources) {
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", resource, ex);
      }
    }
  }

  private static void printDryRunPlan(AgentConfig config, Path configPath, PrintWriter out) {
    List<String> lines = new ArrayList<>();
    lines.add("Agent dry-run: the producer will not be started.");
    lines.add(" Config file      : " + configPath);
    lines.add(" Producer         : " + config.source().command() + " (" + config.source().type() + ")");
    lines.add(" Restart delay    : " + config.source().restartDelay().toSeconds() + "s");
    lines.add(" Cache            : " + config.cache().path() + " valid " + config.cache().validity().toHours()
        + "h load=" + config.cache().load() + " dump=" + config.cache().dump());
    lines.add(" Training filter  : " + (config.ignoreFilterWhenTraining() ? "ignored" : "applied"));
    lines.add(" Report file      : " + (config.report().policy().enabled()
        ? config.report().path() + " rollover " + config.report().fileNamePattern()
        : "<disabled>"));
    lines.add(" Mail             : " + (config.mail().policy().enabled()
        ? config.mail().address() + " via " + config.mail().host() + ":" + config.mail().port()
            + " user " + (config.mail().authenticated() ? config.mail().username() : "<none>")
            + " password " + Logs.redact(config.mail().password())
        : "<disabled>"));
    lines.add(" Console          : " + (config.console().policy().enabled() ? "enabled" : "<disabled>"));
    for (Category category : Category.configurable()) {
      CategoryRule rule = config.categories().get(category);
      String keywords = rule.keywords().isEmpty() ? "*" : String.join(",", rule.keywords());
      lines.add(String.format(" %-25s: %s %s", category.configKey(), rule.enabled() ? "on " : "off", keywords));
    }
    lines.add(" Re-run without --dry-run to start the agent.");
    lines.forEach(out::println);
    out.flush();
  }
}
