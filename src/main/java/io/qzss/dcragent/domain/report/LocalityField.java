package io.qzss.dcragent.domain.report;

/**
 * Locality attribute a report category can be filtered on.
 *
 * <p>Each field names the configuration option that carries its keyword list and the vocabulary
 * file listing every legal value for startup validation.</p>
 *
 * @since 0.1.0
 */
public enum LocalityField {
  /** Category carries no locality list; only the {@code use} switch applies. */
  NONE(null, null),
  EEW_FORECAST_REGION("regions", "eew-forecast-region"),
  PREFECTURE("prefectures", "prefecture"),
  TSUNAMI_FORECAST_REGION("regions", "tsunami-forecast-region"),
  COASTAL_REGION_EN("regions", "coastal-region-en"),
  LOCAL_GOVERNMENT("localGovernments", "local-government"),
  WEATHER_FORECAST_REGION("regions", "weather-forecast-region"),
  FLOOD_FORECAST_REGION("regions", "flood-forecast-region"),
  MARINE_FORECAST_REGION("regions", "marine-forecast-region");

  private final String optionName;
  private final String vocabularyName;

  LocalityField(String optionName, String vocabularyName) {
    this.optionName = optionName;
    this.vocabularyName = vocabularyName;
  }

  /**
   * Returns the configuration option holding the keyword list (e.g. {@code regions}).
   *
   * @return option name; {@code null} for {@link #NONE}
   */
  public String optionName() {
    return optionName;
  }

  /**
   * Returns the base name of the vocabulary file listing legal values.
   *
   * @return vocabulary name; {@code null} for {@link #NONE}
   */
  public String vocabularyName() {
    return vocabularyName;
  }

  /**
   * Indicates whether the category carries a filterable locality list.
   *
   * @return {@code true} for every constant except {@link #NONE}
   */
  public boolean present() {
    return this != NONE;
  }
}
