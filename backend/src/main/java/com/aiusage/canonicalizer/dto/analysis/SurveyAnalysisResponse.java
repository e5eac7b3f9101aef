package com.aiusage.canonicalizer.dto.analysis;

import java.util.List;
import java.util.Map;

import com.aiusage.canonicalizer.model.CategoryCount;
import com.aiusage.canonicalizer.model.CategoryDistribution;
import com.aiusage.canonicalizer.model.FeedbackClassification;
import com.aiusage.canonicalizer.model.FieldDiagnostic;
import com.aiusage.canonicalizer.model.FieldNormalization;
import com.aiusage.canonicalizer.model.HeaderResolution;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SurveyAnalysisResponse {

  @JsonProperty("analysis_id")
  private String analysisId;

  @JsonProperty("table_name")
  private String tableName;

  @JsonProperty("columns")
  private List<String> columns;

  /** Canonical rows: same count and order as the input, values untouched. */
  @JsonProperty("data")
  private List<Map<String, Object>> data;

  @JsonProperty("header_resolution")
  private HeaderResolution headerResolution;

  @JsonProperty("normalizations")
  private Map<String, FieldNormalization> normalizations;

  @JsonProperty("feedback")
  private Map<String, FeedbackClassification> feedback;

  @JsonProperty("summary")
  private SurveySummary summary;

  @JsonProperty("diagnostics")
  private List<FieldDiagnostic> diagnostics;

  @JsonProperty("processing_metadata")
  private ProcessingMetadata processingMetadata;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class SurveySummary {

    @JsonProperty("total_responses")
    private Integer totalResponses;

    @JsonProperty("unique_ai_tools")
    private Integer uniqueAiTools;

    @JsonProperty("average_ease_of_use")
    private Double averageEaseOfUse;

    @JsonProperty("average_efficiency")
    private Double averageEfficiency;

    @JsonProperty("usage_frequency")
    private List<CategoryCount> usageFrequency;

    @JsonProperty("tool_popularity")
    private List<CategoryCount> toolPopularity;

    @JsonProperty("suggestion_categories")
    private CategoryDistribution suggestionCategories;

    @JsonProperty("skipped_features")
    private List<String> skippedFeatures;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ProcessingMetadata {

    @JsonProperty("total_columns")
    private Integer totalColumns;

    @JsonProperty("recognized_columns")
    private Integer recognizedColumns;

    @JsonProperty("total_rows_processed")
    private Integer totalRowsProcessed;

    @JsonProperty("processing_time_ms")
    private Long processingTimeMs;

    @JsonProperty("rule_set_version")
    private String ruleSetVersion;
  }
}
