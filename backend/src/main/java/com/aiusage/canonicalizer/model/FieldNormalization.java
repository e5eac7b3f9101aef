package com.aiusage.canonicalizer.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Labels assigned to one categorical column. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldNormalization {

  @JsonProperty("field")
  private String field;

  /** One label per row, in row order. */
  @JsonProperty("labels")
  private List<String> labels;

  /** Distinct trimmed raw value to label, in first-seen order. */
  @JsonProperty("value_mapping")
  private Map<String, String> valueMapping;

  /** Label given to values no rule recognized. */
  @JsonProperty("fallback_label")
  private String fallbackLabel;

  @JsonProperty("distribution")
  private CategoryDistribution distribution;

  @JsonProperty("unmatched_count")
  private long unmatchedCount;

  @JsonProperty("missing_count")
  private long missingCount;

  @JsonProperty("unmatched_samples")
  private List<String> unmatchedSamples;
}
