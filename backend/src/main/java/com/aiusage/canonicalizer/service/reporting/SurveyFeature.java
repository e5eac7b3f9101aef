package com.aiusage.canonicalizer.service.reporting;

import java.util.List;

import lombok.Getter;

/** Report sections and the canonical fields each one needs. */
@Getter
public enum SurveyFeature {
  DATA_SUMMARY("data_summary", List.of(SurveyFields.AI_TOOL, SurveyFields.EASE_OF_USE)),
  EFFICIENCY_SUMMARY("efficiency_summary", List.of(SurveyFields.EFFICIENCY)),
  USAGE_FREQUENCY_CHART("usage_frequency_chart", List.of(SurveyFields.USAGE_FREQUENCY)),
  TOOL_POPULARITY_CHART("tool_popularity_chart", List.of(SurveyFields.AI_TOOL)),
  SUGGESTION_CATEGORIES("suggestion_categories", List.of(SurveyFields.SUGGESTIONS));

  private final String featureName;
  private final List<String> requiredFields;

  SurveyFeature(String featureName, List<String> requiredFields) {
    this.featureName = featureName;
    this.requiredFields = requiredFields;
  }
}
