package com.aiusage.canonicalizer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** How one raw header was renamed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HeaderMapping {

  @JsonProperty("position")
  private int position;

  @JsonProperty("original")
  private String original;

  /** Canonical-or-passthrough name before collision resolution. */
  @JsonProperty("proposed")
  private String proposed;

  @JsonProperty("canonical")
  private String canonical;

  /** Alias or legacy name that matched, null for passthrough headers. */
  @JsonProperty("matched_alias")
  private String matchedAlias;

  @JsonProperty("recognized")
  private boolean recognized;
}
