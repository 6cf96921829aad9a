package io.qzss.dcragent.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import io.qzss.dcragent.application.port.DcrPayloadDecoder;
import io.qzss.dcragent.application.port.VocabularyProvider;
import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.domain.report.LocalityField;
import io.qzss.dcragent.domain.report.Report;
import io.qzss.dcragent.infrastructure.vocabulary.ResourceVocabularyProvider;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ConfigValidatorTest {
  private static final Logger VALIDATOR_LOGGER = (Logger) LoggerFactory.getLogger(ConfigValidator.class);
  private static final VocabularyProvider VOCABULARY = field -> switch (field) {
    case PREFECTURE -> Optional.of(List.of("東京都", "神奈川県", "大阪府"));
    case TSUNAMI_FORECAST_REGION -> Optional.of(List.of("伊勢・三河湾", "大阪府"));
    default -> Optional.empty();
  };

  @BeforeAll
  static void silence() {
    VALIDATOR_LOGGER.setLevel(Level.OFF);
  }

  @AfterAll
  static void restore() {
    VALIDATOR_LOGGER.setLevel(null);
  }

  @Test
  void defaultConfigurationIsValid() {
    assertTrue(ConfigValidator.validate(AgentConfig.fromMap(Map.of()), VOCABULARY).isEmpty());
  }

  @Test
  void everyKeywordMustMatchSomeLegalValue() {
    AgentConfig config = AgentConfig.fromMap(Map.of(
        "seismicIntensity.prefectures", "東京,神奈川",
        "tsunami.regions", "三河湾,Osaka"));

    List<ConfigValidator.Failure> failures = ConfigValidator.validate(config, VOCABULARY);

    assertEquals(1, failures.size());
    assertEquals(Category.TSUNAMI, failures.get(0).category());
    assertEquals(List.of("Osaka"), failures.get(0).unmatched());
    assertEquals(List.of("伊勢・三河湾", "大阪府"), failures.get(0).legalValues());
  }

  @Test
  void keywordsWithoutVocabularyFail() {
    AgentConfig config = AgentConfig.fromMap(Map.of("volcano.localGovernments", "箱根町"));

    List<ConfigValidator.Failure> failures = ConfigValidator.validate(config, VOCABULARY);

    assertEquals(1, failures.size());
    assertEquals(Category.VOLCANO, failures.get(0).category());
  }

  @Test
  void bundledTsunamiRegionsAcceptIseMikawaBay() {
    AgentConfig config = AgentConfig.fromMap(Map.of("tsunami.regions", "伊勢・三河湾"));

    assertTrue(ConfigValidator.validate(config, new ResourceVocabularyProvider(null)).isEmpty());
  }

  @Test
  void localGovernmentsValidateAgainstDecoderCodeTable() {
    DcrPayloadDecoder decoder = new DcrPayloadDecoder() {
      @Override
      public Optional<Report> decode(byte[] payload) {
        return Optional.empty();
      }

      @Override
      public Optional<List<String>> vocabulary(LocalityField field) {
        return field == LocalityField.LOCAL_GOVERNMENT
            ? Optional.of(List.of("神奈川県箱根町", "鹿児島県鹿児島市"))
            : Optional.empty();
      }
    };
    ResourceVocabularyProvider provider = new ResourceVocabularyProvider(null, Optional.of(decoder));

    AgentConfig accepted = AgentConfig.fromMap(Map.of("volcano.localGovernments", "箱根町"));
    AgentConfig rejected = AgentConfig.fromMap(Map.of("volcano.localGovernments", "富士吉田"));

    assertTrue(ConfigValidator.validate(accepted, provider).isEmpty());
    assertEquals(List.of("富士吉田"), ConfigValidator.validate(rejected, provider).get(0).unmatched());
  }

  @Test
  void unreadableVocabularyFails() {
    VocabularyProvider broken = field -> {
      throw new IOException("permission denied");
    };
    AgentConfig config = AgentConfig.fromMap(Map.of("seismicIntensity.prefectures", "東京"));

    List<ConfigValidator.Failure> failures = ConfigValidator.validate(config, broken);

    assertEquals(1, failures.size());
    assertTrue(failures.get(0).reason().contains("permission denied"));
  }
}
