package com.aiusage.canonicalizer.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Result of canonicalizing and de-colliding a header list; also the debug payload. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeaderResolution {

  @JsonProperty("original_headers")
  private List<String> originalHeaders;

  @JsonProperty("canonical_headers")
  private List<String> canonicalHeaders;

  @JsonProperty("mapping")
  private List<HeaderMapping> mapping;
}
