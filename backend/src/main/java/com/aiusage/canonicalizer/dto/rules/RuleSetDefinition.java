package com.aiusage.canonicalizer.dto.rules;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.aiusage.canonicalizer.model.AliasMatchMode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Declarative canonicalization rules as read from JSON. Compiled by {@code RuleSetCompiler}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Alias table, value normalization rules and feedback classification rules")
public class RuleSetDefinition {

  @JsonProperty("version")
  private String version;

  @Schema(description = "How header aliases are matched", example = "SUBSTRING")
  @JsonProperty("alias_match_mode")
  private AliasMatchMode aliasMatchMode;

  @Schema(description = "Canonical fields in match priority order")
  @JsonProperty("fields")
  @Builder.Default
  private List<FieldDefinition> fields = new ArrayList<>();

  @JsonProperty("value_rules")
  @Builder.Default
  private List<ValueRuleDefinition> valueRules = new ArrayList<>();

  @JsonProperty("feedback_rules")
  @Builder.Default
  private List<FeedbackRuleDefinition> feedbackRules = new ArrayList<>();

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class FieldDefinition {

    @Schema(description = "Canonical field name", example = "usage_frequency")
    @JsonProperty("canonical")
    private String canonical;

    @Schema(description = "Alias patterns, tried in order", example = "[\"usage frequency\"]")
    @JsonProperty("aliases")
    @Builder.Default
    private List<String> aliases = new ArrayList<>();

    @Schema(description = "Exact header names used by older survey versions")
    @JsonProperty("legacy_names")
    @Builder.Default
    private List<String> legacyNames = new ArrayList<>();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ValueRuleDefinition {

    @JsonProperty("field")
    private String field;

    @Schema(description = "Regex/label pairs, first match wins")
    @JsonProperty("rules")
    @Builder.Default
    private List<PatternLabel> rules = new ArrayList<>();

    @JsonProperty("fallback_label")
    private String fallbackLabel;

    @JsonProperty("missing_label")
    private String missingLabel;

    @Schema(description = "Read wholly numeric cells as counts")
    @JsonProperty("numeric_counts")
    private Boolean numericCounts;

    @Schema(example = "{\"1\": \"Once\", \"2\": \"Twice\", \"3\": \"Thrice\"}")
    @JsonProperty("ordinal_labels")
    @Builder.Default
    private Map<Integer, String> ordinalLabels = new LinkedHashMap<>();

    @Schema(example = "{n} times")
    @JsonProperty("count_template")
    private String countTemplate;

    @Schema(description = "Label spelling to display name, applied after rule lookup")
    @JsonProperty("exact_aliases")
    @Builder.Default
    private Map<String, String> exactAliases = new LinkedHashMap<>();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class PatternLabel {

    @JsonProperty("pattern")
    private String pattern;

    @JsonProperty("label")
    private String label;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class FeedbackRuleDefinition {

    @JsonProperty("field")
    private String field;

    @JsonProperty("negative_tokens")
    @Builder.Default
    private List<String> negativeTokens = new ArrayList<>();

    @JsonProperty("no_suggestions_label")
    private String noSuggestionsLabel;

    @JsonProperty("catch_all_label")
    private String catchAllLabel;

    @JsonProperty("categories")
    @Builder.Default
    private List<CategoryDefinition> categories = new ArrayList<>();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CategoryDefinition {

    @JsonProperty("label")
    private String label;

    @JsonProperty("patterns")
    @Builder.Default
    private List<String> patterns = new ArrayList<>();
  }
}
