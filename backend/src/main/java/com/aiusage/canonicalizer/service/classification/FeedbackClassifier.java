package com.aiusage.canonicalizer.service.classification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.aiusage.canonicalizer.model.CategoryPattern;
import com.aiusage.canonicalizer.model.ClassificationRule;
import com.aiusage.canonicalizer.model.FeedbackClassification;
import com.aiusage.canonicalizer.service.distribution.DistributionCalculator;
import com.aiusage.canonicalizer.service.normalization.CellText;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Assigns each free-text response exactly one category of a {@link ClassificationRule}.
 *
 * <p>Negative answers ("none", "n/a", "no thanks") are recognized before any keyword rule so a
 * refusal is never captured by an unrelated keyword. Only a whole reply counts: surrounding
 * punctuation and repeated spaces are ignored, but "No, but more training would help" is not a
 * refusal. Everything else goes through the category
 * groups in declaration order; responses matching none, empty responses and entries that cannot
 * be read as text end in the catch-all category.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedbackClassifier {

  private static final Pattern EDGE_PUNCTUATION =
      Pattern.compile("^[^\\p{L}\\p{Nd}]+|[^\\p{L}\\p{Nd}]+$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final DistributionCalculator distributionCalculator;
  private final ResponseRanker responseRanker;

  public String classify(Object value, ClassificationRule rule) {
    String text = CellText.of(value);
    if (CellText.isBlank(text)) {
      return rule.getCatchAllLabel();
    }

    String normalized = text.toLowerCase(Locale.ROOT);
    if (isNegative(normalized, rule.getNegativeTokens())) {
      return rule.getNoSuggestionsLabel();
    }

    for (CategoryPattern category : rule.getCategories()) {
      if (category.matches(normalized)) {
        return category.getLabel();
      }
    }
    return rule.getCatchAllLabel();
  }

  public FeedbackClassification classifyColumn(
      List<Object> values, ClassificationRule rule, int topLimit) {
    List<String> categories = new ArrayList<>(values.size());
    long unclassified = 0;

    for (int row = 0; row < values.size(); row++) {
      Object value = values.get(row);
      String category;
      try {
        category = classify(value, rule);
      } catch (RuntimeException e) {
        log.warn(
            "Could not classify row {} of field {}, using '{}': {}",
            row,
            rule.getField(),
            rule.getCatchAllLabel(),
            e.getMessage());
        category = rule.getCatchAllLabel();
      }
      if (category.equals(rule.getCatchAllLabel()) && !CellText.isBlank(CellText.of(value))) {
        unclassified++;
      }
      categories.add(category);
    }

    log.debug(
        "Classified {} responses of field {}, {} fell through to '{}'",
        categories.size(),
        rule.getField(),
        unclassified,
        rule.getCatchAllLabel());

    return FeedbackClassification.builder()
        .field(rule.getField())
        .categories(categories)
        .distribution(distributionCalculator.calculate(categories, rule.declaredLabels()))
        .topResponses(responseRanker.rank(values, topLimit))
        .unclassifiedCount(unclassified)
        .build();
  }

  /** True when the lower-cased reply, without edge punctuation, equals one of the tokens. */
  public static boolean isNegative(String normalized, List<String> negativeTokens) {
    String reply =
        WHITESPACE.matcher(EDGE_PUNCTUATION.matcher(normalized).replaceAll("")).replaceAll(" ");
    return negativeTokens.contains(reply);
  }
}
