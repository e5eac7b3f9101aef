package com.aiusage.canonicalizer.service.reporting;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.aiusage.canonicalizer.dto.analysis.SurveyAnalysisResponse.SurveySummary;
import com.aiusage.canonicalizer.exception.MissingRequiredFieldException;
import com.aiusage.canonicalizer.model.CanonicalTable;
import com.aiusage.canonicalizer.model.CategoryCount;
import com.aiusage.canonicalizer.model.DiagnosticKind;
import com.aiusage.canonicalizer.model.FeedbackClassification;
import com.aiusage.canonicalizer.model.FieldDiagnostic;
import com.aiusage.canonicalizer.model.FieldNormalization;
import com.aiusage.canonicalizer.service.normalization.CellText;

import lombok.extern.slf4j.Slf4j;

/**
 * Dashboard figures derived from a canonical table. Each {@link SurveyFeature} is computed on its
 * own: when a field it needs is missing, only that feature is skipped and a diagnostic names the
 * field together with the fields that are available.
 */
@Slf4j
@Service
public class SurveySummaryService {

  public SurveySummary summarize(
      CanonicalTable table,
      Map<String, FieldNormalization> normalizations,
      Map<String, FeedbackClassification> feedback,
      List<FieldDiagnostic> diagnostics) {
    SurveySummary summary = SurveySummary.builder().totalResponses(table.rowCount()).build();
    List<String> skipped = new ArrayList<>();

    for (SurveyFeature feature : SurveyFeature.values()) {
      try {
        for (String field : feature.getRequiredFields()) {
          if (!table.hasColumn(field)) {
            throw new MissingRequiredFieldException(field, table.getHeaders());
          }
        }
        if (!apply(feature, table, normalizations, feedback, summary, diagnostics)) {
          skipped.add(feature.getFeatureName());
        }
      } catch (MissingRequiredFieldException e) {
        log.warn("Skipping {}: {}", feature.getFeatureName(), e.getMessage());
        diagnostics.add(FieldDiagnostic.missingField(feature.getFeatureName(), e));
        skipped.add(feature.getFeatureName());
      }
    }

    summary.setSkippedFeatures(skipped);
    return summary;
  }

  private boolean apply(
      SurveyFeature feature,
      CanonicalTable table,
      Map<String, FieldNormalization> normalizations,
      Map<String, FeedbackClassification> feedback,
      SurveySummary summary,
      List<FieldDiagnostic> diagnostics) {
    switch (feature) {
      case DATA_SUMMARY -> {
        summary.setUniqueAiTools(
            countUniqueTools(
                table.requireColumn(SurveyFields.AI_TOOL),
                normalizations.get(SurveyFields.AI_TOOL)));
        summary.setAverageEaseOfUse(
            average(
                SurveyFields.EASE_OF_USE,
                table.requireColumn(SurveyFields.EASE_OF_USE),
                diagnostics));
        return true;
      }
      case EFFICIENCY_SUMMARY -> {
        summary.setAverageEfficiency(
            average(
                SurveyFields.EFFICIENCY,
                table.requireColumn(SurveyFields.EFFICIENCY),
                diagnostics));
        return true;
      }
      case USAGE_FREQUENCY_CHART -> {
        FieldNormalization usage = normalizations.get(SurveyFields.USAGE_FREQUENCY);
        if (usage == null) {
          diagnostics.add(missingRule(feature, SurveyFields.USAGE_FREQUENCY));
          return false;
        }
        summary.setUsageFrequency(usage.getDistribution().getEntries());
        return true;
      }
      case TOOL_POPULARITY_CHART -> {
        FieldNormalization tools = normalizations.get(SurveyFields.AI_TOOL);
        if (tools == null) {
          diagnostics.add(missingRule(feature, SurveyFields.AI_TOOL));
          return false;
        }
        summary.setToolPopularity(byPopularity(tools.getDistribution().getEntries()));
        return true;
      }
      case SUGGESTION_CATEGORIES -> {
        FeedbackClassification suggestions = feedback.get(SurveyFields.SUGGESTIONS);
        if (suggestions == null) {
          diagnostics.add(missingRule(feature, SurveyFields.SUGGESTIONS));
          return false;
        }
        summary.setSuggestionCategories(suggestions.getDistribution());
        return true;
      }
      default -> throw new IllegalStateException("Unhandled feature " + feature);
    }
  }

  /**
   * Distinct tools among answered rows. Recognized tools count once per normalized label; tools
   * that fell back to the catch-all label count once per case-folded answer.
   */
  private int countUniqueTools(List<Object> values, FieldNormalization normalization) {
    Set<String> distinct = new HashSet<>();
    for (int row = 0; row < values.size(); row++) {
      String text = CellText.of(values.get(row));
      if (CellText.isBlank(text)) {
        continue;
      }
      String raw = "raw:" + text.toLowerCase(Locale.ROOT);
      if (normalization == null) {
        distinct.add(raw);
        continue;
      }
      String label = normalization.getLabels().get(row);
      distinct.add(label.equals(normalization.getFallbackLabel()) ? raw : "label:" + label);
    }
    return distinct.size();
  }

  private Double average(String field, List<Object> values, List<FieldDiagnostic> diagnostics) {
    BigDecimal sum = BigDecimal.ZERO;
    int numeric = 0;
    List<String> rejected = new ArrayList<>();

    for (Object value : values) {
      String text = CellText.of(value);
      if (CellText.isBlank(text)) {
        continue;
      }
      BigDecimal score = parseScore(text);
      if (score == null) {
        rejected.add(text);
        continue;
      }
      sum = sum.add(score);
      numeric++;
    }

    if (!rejected.isEmpty()) {
      diagnostics.add(
          FieldDiagnostic.builder()
              .kind(DiagnosticKind.UNCLASSIFIABLE_VALUE)
              .field(field)
              .message(
                  String.format(
                      "Field '%s': %d value(s) are not finite numbers and were left out of the"
                          + " average",
                      field, rejected.size()))
              .affectedRows((long) rejected.size())
              .samples(new ArrayList<>(rejected.subList(0, Math.min(5, rejected.size()))))
              .build());
    }

    if (numeric == 0) {
      return null;
    }
    return sum.divide(BigDecimal.valueOf(numeric), 1, RoundingMode.HALF_UP).doubleValue();
  }

  /** A finite number, or null for text, NaN and infinities. */
  private BigDecimal parseScore(String text) {
    try {
      double value = Double.parseDouble(text);
      return Double.isFinite(value) ? BigDecimal.valueOf(value) : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private List<CategoryCount> byPopularity(List<CategoryCount> entries) {
    List<CategoryCount> popular = new ArrayList<>();
    for (CategoryCount entry : entries) {
      if (entry.getCount() > 0) {
        popular.add(entry);
      }
    }
    popular.sort(Comparator.comparingLong(CategoryCount::getCount).reversed());
    return popular;
  }

  private FieldDiagnostic missingRule(SurveyFeature feature, String field) {
    log.warn("Skipping {}: no rule configured for field {}", feature.getFeatureName(), field);
    return FieldDiagnostic.builder()
        .kind(DiagnosticKind.MISSING_RULE)
        .field(field)
        .feature(feature.getFeatureName())
        .message(
            String.format(
                "Skipped %s: no normalization or classification rule is configured for field '%s'",
                feature.getFeatureName(), field))
        .build();
  }
}
