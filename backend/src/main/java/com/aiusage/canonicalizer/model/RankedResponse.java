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
public class RankedResponse {

  /** First-seen spelling, trimmed. */
  @JsonProperty("text")
  private String text;

  @JsonProperty("count")
  private long count;
}
