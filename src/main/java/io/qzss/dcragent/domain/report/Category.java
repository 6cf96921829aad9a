package io.qzss.dcragent.domain.report;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of disaster report kinds together with their policy table row.
 * <p><strong>Why:</strong> Filtering, mail subjects and configuration parsing all read the same row, so adding a
 * category is a single constant rather than a branch repeated across call sites.</p>
 * <p><strong>Role:</strong> Domain value shared by decoder adapters, the filter engine and the cache schema.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Category {
  EARTHQUAKE_EARLY_WARNING("earthquakeEarlyWarning", Family.JMA, LocalityField.EEW_FORECAST_REGION, false, null),
  HYPOCENTER("hypocenter", Family.JMA, LocalityField.NONE, false, null),
  SEISMIC_INTENSITY("seismicIntensity", Family.JMA, LocalityField.PREFECTURE, false, null),
  NANKAI_TROUGH_EARTHQUAKE("nankaiTroughEarthquake", Family.JMA, LocalityField.NONE, true, null),
  TSUNAMI("tsunami", Family.JMA, LocalityField.TSUNAMI_FORECAST_REGION, false, null),
  NORTHWEST_PACIFIC_TSUNAMI(
      "northwestPacificTsunami", Family.JMA, LocalityField.COASTAL_REGION_EN, false, null),
  VOLCANO("volcano", Family.JMA, LocalityField.LOCAL_GOVERNMENT, false, null),
  ASH_FALL("ashFall", Family.JMA, LocalityField.LOCAL_GOVERNMENT, false, null),
  WEATHER("weather", Family.JMA, LocalityField.WEATHER_FORECAST_REGION, false, null),
  FLOOD("flood", Family.JMA, LocalityField.FLOOD_FORECAST_REGION, false, null),
  TYPHOON("typhoon", Family.JMA, LocalityField.NONE, false, null),
  MARINE("marine", Family.JMA, LocalityField.MARINE_FORECAST_REGION, false, null),
  J_ALERT("jAlert", Family.EXTENDED, LocalityField.NONE, false, "Jアラート"),
  L_ALERT("lAlert", Family.EXTENDED, LocalityField.NONE, false, "Lアラート"),
  MUNICIPALITY("municipality", Family.EXTENDED, LocalityField.NONE, false, "市町村からのお知らせ"),
  OUTSIDE_JAPAN("outsideJapan", Family.EXTENDED, LocalityField.NONE, false, "海外機関からのお知らせ"),
  /** Null message broadcast while no report is active; always dropped. */
  NULL(null, Family.NOISE, LocalityField.NONE, false, null),
  /** Report kind the decoder produced but this agent does not know. */
  UNKNOWN(null, Family.NOISE, LocalityField.NONE, false, null);

  /** Report families sharing delivery rules. */
  public enum Family {
    /** Japan Meteorological Agency reports (DCR). */
    JMA,
    /** Extended messages (DCX): J-Alert, L-Alert, municipalities, overseas agencies. */
    EXTENDED,
    /** Never delivered. */
    NOISE
  }

  private static final List<Category> CONFIGURABLE =
      Arrays.stream(values()).filter(c -> c.family != Family.NOISE).toList();

  private final String configKey;
  private final Family family;
  private final LocalityField localityField;
  private final boolean multiPart;
  private final String mailLabel;

  Category(
      String configKey,
      Family family,
      LocalityField localityField,
      boolean multiPart,
      String mailLabel) {
    this.configKey = configKey;
    this.family = family;
    this.localityField = localityField;
    this.multiPart = multiPart;
    this.mailLabel = mailLabel;
  }

  /**
   * Returns the configuration section name, e.g. {@code tsunami}.
   *
   * @return config key; {@code null} for {@link Family#NOISE} categories
   */
  public String configKey() {
    return configKey;
  }

  public Family family() {
    return family;
  }

  public LocalityField localityField() {
    return localityField;
  }

  /**
   * Indicates whether reports of this category can arrive as partial transmissions.
   *
   * @return {@code true} only for the Nankai-trough report
   */
  public boolean multiPart() {
    return multiPart;
  }

  /**
   * Fixed mail subject label for the extended family.
   *
   * @return label, or empty for categories whose subject comes from the report header
   */
  public Optional<String> mailLabel() {
    return Optional.ofNullable(mailLabel);
  }

  /**
   * Lists the categories operators can configure, in declaration order.
   *
   * @return immutable list excluding {@link #NULL} and {@link #UNKNOWN}
   */
  public static List<Category> configurable() {
    return CONFIGURABLE;
  }

  /**
   * Resolves a category name as written by decoders, falling back to {@link #UNKNOWN}.
   *
   * @param name enum constant name (case-insensitive); may be {@code null}
   * @return matching category or {@link #UNKNOWN}
   */
  public static Category fromName(String name) {
    if (name == null || name.isBlank()) {
      return UNKNOWN;
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (Category category : values()) {
      if (category.name().equals(normalized)) {
        return category;
      }
    }
    return UNKNOWN;
  }
}
