package com.aiusage.canonicalizer.service.normalization;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.aiusage.canonicalizer.model.FieldNormalization;
import com.aiusage.canonicalizer.model.NormalizationRule;
import com.aiusage.canonicalizer.model.ValuePattern;
import com.aiusage.canonicalizer.service.distribution.DistributionCalculator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps free-form cell values of one canonical field onto the labels of a {@link
 * NormalizationRule}. Each value is normalized on its own, so the label never depends on other
 * rows.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategoricalValueNormalizer {

  private static final Pattern WHOLE_NUMBER = Pattern.compile("^(\\d+)(?:\\.0+)?$");
  private static final int MAX_UNMATCHED_SAMPLES = 5;

  private final DistributionCalculator distributionCalculator;

  public String normalize(Object value, NormalizationRule rule) {
    return evaluate(value, rule).label;
  }

  public FieldNormalization normalizeColumn(List<Object> values, NormalizationRule rule) {
    List<String> labels = new ArrayList<>(values.size());
    Map<String, String> valueMapping = new LinkedHashMap<>();
    List<String> unmatchedSamples = new ArrayList<>();
    long unmatched = 0;
    long missing = 0;

    for (Object value : values) {
      Outcome outcome = evaluate(value, rule);
      labels.add(outcome.label);

      switch (outcome.kind) {
        case MISSING -> missing++;
        case UNMATCHED -> {
          unmatched++;
          if (unmatchedSamples.size() < MAX_UNMATCHED_SAMPLES
              && !unmatchedSamples.contains(outcome.text)) {
            unmatchedSamples.add(outcome.text);
          }
        }
        default -> {
          // matched, nothing to record
        }
      }
      if (outcome.text != null) {
        valueMapping.putIfAbsent(outcome.text, outcome.label);
      }
    }

    if (unmatched > 0) {
      log.debug(
          "Field {}: {} value(s) matched no rule, e.g. {}",
          rule.getField(),
          unmatched,
          unmatchedSamples);
    }

    return FieldNormalization.builder()
        .field(rule.getField())
        .labels(labels)
        .valueMapping(valueMapping)
        .fallbackLabel(rule.getFallbackLabel())
        .distribution(distributionCalculator.calculate(labels, rule.declaredLabels()))
        .unmatchedCount(unmatched)
        .missingCount(missing)
        .unmatchedSamples(unmatchedSamples)
        .build();
  }

  private Outcome evaluate(Object value, NormalizationRule rule) {
    String text = CellText.of(value);
    if (CellText.isBlank(text)) {
      return new Outcome(rule.getMissingLabel(), Kind.MISSING, null);
    }

    String normalized = text.toLowerCase(Locale.ROOT);

    if (rule.isNumericCounts()) {
      Integer count = parseCount(normalized);
      if (count != null) {
        return new Outcome(rule.displayName(rule.countLabel(count)), Kind.MATCHED, text);
      }
    }

    for (ValuePattern pattern : rule.getPatterns()) {
      if (pattern.matches(normalized)) {
        return new Outcome(rule.displayName(pattern.getLabel()), Kind.MATCHED, text);
      }
    }

    return new Outcome(rule.getFallbackLabel(), Kind.UNMATCHED, text);
  }

  private Integer parseCount(String normalized) {
    Matcher matcher = WHOLE_NUMBER.matcher(normalized);
    if (!matcher.matches()) {
      return null;
    }
    try {
      return Integer.valueOf(matcher.group(1));
    } catch (NumberFormatException e) {
      log.debug("Numeric value {} too large for a count, using text rules", normalized);
      return null;
    }
  }

  private enum Kind {
    MATCHED,
    UNMATCHED,
    MISSING
  }

  private static final class Outcome {
    final String label;
    final Kind kind;
    final String text;

    Outcome(String label, Kind kind, String text) {
      this.label = label;
      this.kind = kind;
      this.text = text;
    }
  }
}
