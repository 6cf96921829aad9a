package io.qzss.dcragent.config;

import io.qzss.dcragent.application.dispatch.DeliveryPolicy;
import io.qzss.dcragent.application.filter.CategoryRule;
import io.qzss.dcragent.application.filter.KeywordMatcher;
import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.domain.report.SourceType;
import io.qzss.dcragent.validation.Net;
import io.qzss.dcragent.validation.Numbers;
import io.qzss.dcragent.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable, fully parsed agent configuration.
 * <p><strong>Why:</strong> Built once at startup from defaults, the YAML file and CLI overrides, then handed to
 * {@link CompositionRoot}; nothing reads configuration after that.</p>
 * <p><strong>Keys:</strong> flat dotted names such as {@code tsunami.regions} or {@code mail.host}; see
 * {@link #defaults()} for the complete set.</p>
 *
 * @param source producer settings
 * @param cache duplicate cache settings
 * @param ignoreFilterWhenTraining deliver drills even when the category filter rejects them
 * @param categories rule per configurable category
 * @param report report file channel
 * @param mail mail channel
 * @param console console channel
 * @param vocabularyDirectory directory overriding bundled vocabularies; {@code null} when unset
 * @since 0.1.0
 */
public record AgentConfig(
    SourceSettings source,
    CacheSettings cache,
    boolean ignoreFilterWhenTraining,
    Map<Category, CategoryRule> categories,
    FileSinkSettings report,
    MailSettings mail,
    ConsoleSettings console,
    Path vocabularyDirectory) {

  /** Configuration file read when {@code config=} is not given. */
  public static final Path DEFAULT_CONFIG_PATH = Path.of("/etc/qzssdcragent.yaml");

  static final String DEFAULT_COMMAND = "stdbuf -oL gpsmon -a";
  static final String DEFAULT_REPORT_PATH = "/var/log/qzssdcragent.log";
  static final String DEFAULT_CACHE_PATH = "/var/tmp/qzssdcragent.cache.json";
  static final int MAX_VALID_PERIOD_HOURS = 24 * 365;

  public AgentConfig {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(cache, "cache");
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(mail, "mail");
    Objects.requireNonNull(console, "console");
    Map<Category, CategoryRule> copy = new EnumMap<>(Category.class);
    for (Category category : Category.configurable()) {
      copy.put(category, CategoryRule.ALLOW_ALL);
    }
    if (categories != null) {
      copy.putAll(categories);
    }
    categories = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns every recognised key with its default value.
   *
   * @return ordered map; blank values mean "unset"
   */
  public static Map<String, String> defaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("source.command", DEFAULT_COMMAND);
    map.put("source.type", "gpsmon");
    map.put("source.restartDelaySeconds", "5");
    map.put("cache.path", DEFAULT_CACHE_PATH);
    map.put("cache.validPeriodHours", "24");
    map.put("cache.load", "true");
    map.put("cache.dump", "true");
    map.put("general.ignoreFilterWhenTraining", "false");
    map.put("vocabulary.dir", "");
    for (Category category : Category.configurable()) {
      map.put(category.configKey() + ".use", "true");
      if (category.localityField().present()) {
        map.put(category.configKey() + "." + category.localityField().optionName(), "");
      }
    }
    map.put("report.use", "true");
    map.put("report.path", DEFAULT_REPORT_PATH);
    map.put("report.fileNamePattern", "");
    map.put("report.maxHistory", "5");
    map.put("report.rawPackets", "false");
    map.put("report.reportIncompleteInfo", "false");
    map.put("report.reportTraining", "true");
    map.put("report.ignoreFilter", "true");
    map.put("mail.use", "false");
    map.put("mail.host", "");
    map.put("mail.port", "");
    map.put("mail.id", "");
    map.put("mail.password", "");
    map.put("mail.address", "");
    map.put("mail.from", "");
    map.put("mail.tls", "false");
    map.put("mail.ssl", "false");
    map.put("mail.timeoutMillis", "30000");
    map.put("mail.suppressHeaderFromText", "true");
    map.put("mail.reportIncompleteInfo", "false");
    map.put("mail.reportTraining", "true");
    map.put("mail.ignoreFilter", "false");
    map.put("console.use", "false");
    map.put("console.reportIncompleteInfo", "false");
    map.put("console.reportTraining", "true");
    map.put("console.ignoreFilter", "false");
    return map;
  }

  /**
   * Returns the recognised configuration keys.
   *
   * @return key set of {@link #defaults()}
   */
  public static Set<String> knownKeys() {
    return defaults().keySet();
  }

  /**
   * Parses a flat key/value map, falling back to {@link #defaults()} for missing keys.
   *
   * @param kv effective configuration
   * @return parsed configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static AgentConfig fromMap(Map<String, String> kv) {
    Map<String, String> effective = new LinkedHashMap<>(defaults());
    if (kv != null) {
      kv.forEach((key, value) -> {
        if (key != null && value != null) {
          effective.put(key, value);
        }
      });
    }

    SourceSettings source = new SourceSettings(
        Strings.requireNonBlank("source.command", effective.get("source.command")),
        SourceType.fromString(Strings.requireNonBlank("source.type", effective.get("source.type"))),
        Duration.ofSeconds(parseBoundedInt(effective, "source.restartDelaySeconds", 0, 3_600)));

    CacheSettings cache = new CacheSettings(
        parsePath("cache.path", effective.get("cache.path")),
        Duration.ofHours(parseBoundedInt(effective, "cache.validPeriodHours", 1, MAX_VALID_PERIOD_HOURS)),
        parseBoolean(effective, "cache.load"),
        parseBoolean(effective, "cache.dump"));

    Map<Category, CategoryRule> categories = new EnumMap<>(Category.class);
    for (Category category : Category.configurable()) {
      boolean enabled = parseBoolean(effective, category.configKey() + ".use");
      String keywords = category.localityField().present()
          ? effective.get(category.configKey() + "." + category.localityField().optionName())
          : null;
      categories.put(category, new CategoryRule(enabled, KeywordMatcher.parseList(keywords)));
    }

    Path reportPath = parsePath("report.path", effective.get("report.path"));
    String pattern = effective.get("report.fileNamePattern");
    if (pattern == null || pattern.isBlank()) {
      pattern = reportPath + ".%d{yyyy-ww}";
    } else if (!pattern.contains("%d")) {
      throw new IllegalArgumentException("report.fileNamePattern must contain a %d{...} date token");
    }
    FileSinkSettings report = new FileSinkSettings(
        reportPath,
        pattern.trim(),
        parseBoundedInt(effective, "report.maxHistory", 0, 1_000),
        parseBoolean(effective, "report.rawPackets"),
        policy(effective, "report"));

    String vocabularyDir = effective.get("vocabulary.dir");
    return new AgentConfig(
        source,
        cache,
        parseBoolean(effective, "general.ignoreFilterWhenTraining"),
        categories,
        report,
        parseMail(effective),
        new ConsoleSettings(policy(effective, "console")),
        vocabularyDir == null || vocabularyDir.isBlank() ? null : parsePath("vocabulary.dir", vocabularyDir));
  }

  private static MailSettings parseMail(Map<String, String> kv) {
    DeliveryPolicy policy = policy(kv, "mail");
    boolean ssl = parseBoolean(kv, "mail.ssl");
    boolean tls = parseBoolean(kv, "mail.tls");
    int port;
    String rawPort = kv.get("mail.port");
    if (rawPort == null || rawPort.isBlank() || rawPort.trim().equals("0")) {
      port = ssl ? 465 : tls ? 587 : 25;
    } else {
      port = Net.validatePort("mail.port", parseBoundedInt(kv, "mail.port", 1, 65_535));
    }
    String host = kv.getOrDefault("mail.host", "").trim();
    String address = kv.getOrDefault("mail.address", "").trim();
    if (policy.enabled()) {
      host = Net.validateHost("mail.host", host);
      address = Strings.requireNonBlank("mail.address", address);
    }
    return new MailSettings(
        host,
        port,
        kv.getOrDefault("mail.id", "").trim(),
        kv.getOrDefault("mail.password", ""),
        address,
        kv.getOrDefault("mail.from", "").trim(),
        tls,
        ssl,
        Duration.ofMillis(parseBoundedInt(kv, "mail.timeoutMillis", 1_000, 600_000)),
        parseBoolean(kv, "mail.suppressHeaderFromText"),
        policy);
  }

  private static DeliveryPolicy policy(Map<String, String> kv, String channel) {
    return new DeliveryPolicy(
        parseBoolean(kv, channel + ".use"),
        parseBoolean(kv, channel + ".reportIncompleteInfo"),
        parseBoolean(kv, channel + ".reportTraining"),
        parseBoolean(kv, channel + ".ignoreFilter"));
  }

  static boolean parseBoolean(Map<String, String> kv, String key) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " must be set");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "1", "true", "yes", "on" -> true;
      case "0", "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean (1/0, true/false) but was " + raw);
    };
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(key + " must be set");
    }
    try {
      int parsed = Integer.parseInt(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
