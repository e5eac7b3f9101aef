package com.aiusage.canonicalizer.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts and one-decimal percentages per label. Percentages of a non-empty distribution total
 * exactly 100.0 (largest remainder rounding).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryDistribution {

  @JsonProperty("total")
  private long total;

  @JsonProperty("entries")
  private List<CategoryCount> entries;

  public long countOf(String label) {
    CategoryCount entry = find(label);
    return entry != null ? entry.getCount() : 0L;
  }

  public double percentageOf(String label) {
    CategoryCount entry = find(label);
    return entry != null ? entry.getPercentage() : 0.0;
  }

  public Map<String, Double> toPercentageMap() {
    Map<String, Double> map = new LinkedHashMap<>();
    for (CategoryCount entry : entries) {
      map.put(entry.getLabel(), entry.getPercentage());
    }
    return map;
  }

  private CategoryCount find(String label) {
    if (entries == null) {
      return null;
    }
    for (CategoryCount entry : entries) {
      if (entry.getLabel().equals(label)) {
        return entry;
      }
    }
    return null;
  }
}
