package io.qzss.dcragent.config;

import io.qzss.dcragent.application.filter.CategoryRule;
import io.qzss.dcragent.application.filter.KeywordMatcher;
import io.qzss.dcragent.application.port.VocabularyProvider;
import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.domain.report.LocalityField;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Startup check that every configured locality keyword names a real region, prefecture or
 * local government.
 * <p><strong>Why:</strong> A misspelt keyword would silently stop a category from ever notifying; the agent refuses
 * to start instead.</p>
 * <p><strong>Rule:</strong> every non-blank keyword must be a substring of some legal value of the category's
 * field. Keywords configured for a field without an installed vocabulary fail as well.</p>
 *
 * @since 0.1.0
 */
public final class ConfigValidator {
  private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

  private ConfigValidator() {}

  /**
   * One category whose keywords failed validation.
   *
   * @param category offending category
   * @param unmatched keywords without a legal counterpart
   * @param legalValues the field's vocabulary; empty when none is installed
   * @param reason human readable summary
   */
  public record Failure(Category category, List<String> unmatched, List<String> legalValues, String reason) {
    public Failure {
      unmatched = List.copyOf(unmatched);
      legalValues = List.copyOf(legalValues);
    }
  }

  /**
   * Validates {@code config} and logs every failure at ERROR.
   *
   * @param config parsed configuration
   * @param vocabularies legal values per field
   * @return failures in category order; empty when the configuration is valid
   */
  public static List<Failure> validate(AgentConfig config, VocabularyProvider vocabularies) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(vocabularies, "vocabularies");
    List<Failure> failures = new ArrayList<>();
    for (Map.Entry<Category, CategoryRule> entry : config.categories().entrySet()) {
      Category category = entry.getKey();
      LocalityField field = category.localityField();
      List<String> keywords = entry.getValue().keywords();
      if (!field.present() || KeywordMatcher.isUnfiltered(keywords)) {
        continue;
      }
      String option = category.configKey() + "." + field.optionName();
      Optional<List<String>> vocabulary;
      try {
        vocabulary = vocabularies.values(field);
      } catch (IOException ex) {
        log.debug("Vocabulary read failed for {}", field, ex);
        failures.add(new Failure(category, keywords, List.of(),
            option + ": unable to read vocabulary " + field.vocabularyName() + " (" + ex.getMessage() + ")"));
        continue;
      }
      if (vocabulary.isEmpty()) {
        failures.add(new Failure(category, keywords, List.of(),
            option + ": no vocabulary installed for " + field.vocabularyName()));
        continue;
      }
      if (!KeywordMatcher.matchesAll(keywords, vocabulary.get())) {
        List<String> unmatched = KeywordMatcher.unmatched(keywords, vocabulary.get());
        failures.add(new Failure(category, unmatched, vocabulary.get(),
            option + ": unknown keywords " + unmatched));
      }
    }
    for (Failure failure : failures) {
      if (failure.legalValues().isEmpty()) {
        log.error("Config check error: {}", failure.reason());
      } else {
        log.error("Config check error: {}\n Valid values: {}", failure.reason(), failure.legalValues());
      }
    }
    return failures;
  }
}
