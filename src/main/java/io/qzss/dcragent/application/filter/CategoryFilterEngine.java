package io.qzss.dcragent.application.filter;

import io.qzss.dcragent.domain.report.Category;
import io.qzss.dcragent.domain.report.Disposition;
import io.qzss.dcragent.domain.report.Report;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes the {@link Disposition} of a report from the operator's category rules.
 * <p><strong>Why:</strong> Every notification channel consumes the same three flags, so they are computed once.</p>
 * <p><strong>Role:</strong> Application service invoked by {@code ReportPipeline} after duplicate suppression.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply the category {@code use} switch and its locality keywords from the {@link Category} table.</li>
 *   <li>Flag drills and partial multi-part transmissions.</li>
 *   <li>Lift the filter for drills when {@code ignoreFilterWhenTraining} is set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 * <p><strong>Observability:</strong> Logs every filtered report at INFO with its reason.</p>
 *
 * @since 0.1.0
 */
public final class CategoryFilterEngine {
  private static final Logger log = LoggerFactory.getLogger(CategoryFilterEngine.class);

  private final Map<Category, CategoryRule> rules;
  private final boolean ignoreFilterWhenTraining;

  /**
   * Creates an engine.
   *
   * @param rules rule per category; categories without a rule are enabled and unfiltered
   * @param ignoreFilterWhenTraining deliver drills even when the category rule would filter them
   */
  public CategoryFilterEngine(Map<Category, CategoryRule> rules, boolean ignoreFilterWhenTraining) {
    Objects.requireNonNull(rules, "rules");
    this.rules = rules.isEmpty() ? Map.of() : new EnumMap<>(rules);
    this.ignoreFilterWhenTraining = ignoreFilterWhenTraining;
  }

  /**
   * Evaluates {@code report}.
   *
   * @param report decoded report
   * @return disposition, or empty for {@link Category.Family#NOISE} categories, which are never delivered
   */
  public Optional<Disposition> evaluate(Report report) {
    Category category = report.category();
    if (category.family() == Category.Family.NOISE) {
      return Optional.empty();
    }
    CategoryRule rule = rules.getOrDefault(category, CategoryRule.ALLOW_ALL);

    boolean filtered = false;
    if (!rule.enabled()) {
      filtered = true;
      log.info("Filtered {}: use=false", category.configKey());
    } else if (category.localityField().present()
        && !KeywordMatcher.matchesAny(rule.keywords(), report.localities())) {
      filtered = true;
      log.info("Filtered {}: {} {} not matched by {}",
          category.configKey(), category.localityField().optionName(), report.localities(), rule.keywords());
    }

    boolean training = report.training();
    boolean incomplete = category.multiPart() && Boolean.FALSE.equals(report.completed());

    if (training && filtered && ignoreFilterWhenTraining) {
      log.info("Training report for {} delivered despite filter", category.configKey());
      filtered = false;
    }
    return Optional.of(new Disposition(filtered, training, incomplete));
  }
}
