package com.aiusage.canonicalizer.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Categories assigned to one free-text column. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackClassification {

  @JsonProperty("field")
  private String field;

  /** One category per row, in row order. */
  @JsonProperty("categories")
  private List<String> categories;

  @JsonProperty("distribution")
  private CategoryDistribution distribution;

  @JsonProperty("top_responses")
  private List<RankedResponse> topResponses;

  /** Non-empty rows that fell through to the catch-all category. */
  @JsonProperty("unclassified_count")
  private long unclassifiedCount;
}
