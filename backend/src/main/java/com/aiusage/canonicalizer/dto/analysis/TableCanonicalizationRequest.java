package com.aiusage.canonicalizer.dto.analysis;

import java.util.List;
import java.util.Map;

import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableCanonicalizationRequest {

  @JsonProperty("table_name")
  private String tableName;

  @Schema(description = "Raw headers in column order; duplicates allowed")
  @NotNull
  @NotEmpty
  @JsonProperty("columns")
  private List<String> columns;

  @Schema(description = "Positional rows, one cell per column. Takes precedence over data")
  @JsonProperty("rows")
  private List<List<Object>> rows;

  @Schema(description = "Rows as objects keyed by raw header")
  @JsonProperty("data")
  private List<Map<String, Object>> data;

  @Schema(description = "Inline rule set replacing the configured one for this request")
  @Valid
  @JsonProperty("rules")
  private RuleSetDefinition rules;

  @Positive
  @JsonProperty("top_responses")
  private Integer topResponses;
}
