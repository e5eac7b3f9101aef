package com.aiusage.canonicalizer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryCount {

  @JsonProperty("label")
  private String label;

  @JsonProperty("count")
  private long count;

  @JsonProperty("percentage")
  private double percentage;
}
