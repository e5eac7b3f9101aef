package com.aiusage.canonicalizer.dto.analysis;

import java.util.List;

import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeaderPreviewRequest {

  @Schema(description = "Raw headers in column order")
  @NotNull
  @JsonProperty("headers")
  private List<String> headers;

  @Valid
  @JsonProperty("rules")
  private RuleSetDefinition rules;
}
