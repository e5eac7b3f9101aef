package com.aiusage.canonicalizer.UnitTests.service.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition.CategoryDefinition;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition.FeedbackRuleDefinition;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition.FieldDefinition;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition.PatternLabel;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition.ValueRuleDefinition;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition;
import com.aiusage.canonicalizer.exception.InvalidRuleSetException;
import com.aiusage.canonicalizer.fixtures.TestFixtures;
import com.aiusage.canonicalizer.model.AliasMatchMode;
import com.aiusage.canonicalizer.model.ClassificationRule;
import com.aiusage.canonicalizer.model.NormalizationRule;
import com.aiusage.canonicalizer.model.RuleSet;
import com.aiusage.canonicalizer.service.rules.RuleSetCompiler;

@DisplayName("RuleSetCompiler")
class RuleSetCompilerTest {

  private RuleSetCompiler compiler;

  @BeforeEach
  void setUp() {
    compiler = new RuleSetCompiler();
  }

  private static FieldDefinition field(String canonical, String... aliases) {
    return FieldDefinition.builder().canonical(canonical).aliases(List.of(aliases)).build();
  }

  private static ValueRuleDefinition.ValueRuleDefinitionBuilder usageRule() {
    return ValueRuleDefinition.builder()
        .field("usage_frequency")
        .rules(
            List.of(
                PatternLabel.builder().pattern("daily").label("Daily").build(),
                PatternLabel.builder().pattern("weekly").label("Weekly").build()));
  }

  @Nested
  @DisplayName("Valid definitions")
  class ValidDefinitions {

    @Test
    void shouldCompileShippedRuleSet() {
      RuleSet ruleSet = compiler.compile(TestFixtures.defaultRuleSetDefinition());

      assertThat(ruleSet.getAliasTable().canonicalNames())
          .containsExactly(
              "timestamp",
              "department",
              "job_role",
              "usage_frequency",
              "ai_tool",
              "purpose",
              "ease_of_use",
              "efficiency",
              "suggestions");
      assertThat(ruleSet.getValueRules()).containsKeys("usage_frequency", "ai_tool", "purpose");
      assertThat(ruleSet.getFeedbackRules()).containsKey("suggestions");
      assertThat(ruleSet.getValueRules().get("usage_frequency").declaredLabels())
          .containsExactly("Daily", "Weekly", "Monthly", "Rarely", "Never");
    }

    @Test
    void shouldApplyDefaultLabelsAndMode() {
      RuleSet ruleSet =
          compiler.compile(
              RuleSetDefinition.builder()
                  .fields(List.of(field("usage_frequency", "frequency")))
                  .valueRules(List.of(usageRule().build()))
                  .feedbackRules(
                      List.of(
                          FeedbackRuleDefinition.builder()
                              .field("suggestions")
                              .categories(
                                  List.of(
                                      CategoryDefinition.builder()
                                          .label("Training")
                                          .patterns(List.of("train"))
                                          .build()))
                              .build()))
                  .build());

      NormalizationRule usage = ruleSet.getValueRules().get("usage_frequency");
      ClassificationRule suggestions = ruleSet.getFeedbackRules().get("suggestions");

      assertThat(ruleSet.getAliasTable().getMatchMode()).isEqualTo(AliasMatchMode.SUBSTRING);
      assertThat(usage.getFallbackLabel()).isEqualTo("Other");
      assertThat(usage.getMissingLabel()).isEqualTo("Unknown");
      assertThat(usage.isNumericCounts()).isFalse();
      assertThat(suggestions.getNoSuggestionsLabel()).isEqualTo("No suggestions");
      assertThat(suggestions.getCatchAllLabel()).isEqualTo("Other");
    }

    @Test
    void shouldCompilePatternsCaseInsensitively() {
      RuleSet ruleSet =
          compiler.compile(
              RuleSetDefinition.builder()
                  .fields(List.of(field("usage_frequency", "frequency")))
                  .valueRules(List.of(usageRule().build()))
                  .build());

      NormalizationRule usage = ruleSet.getValueRules().get("usage_frequency");
      assertThat(usage.getPatterns().get(0).matches("DAILY")).isTrue();
    }

    @Test
    void shouldNormalizeTokensAndAliasKeys() {
      RuleSet ruleSet =
          compiler.compile(
              RuleSetDefinition.builder()
                  .fields(List.of(field("ai_tool", "tool")))
                  .valueRules(
                      List.of(
                          ValueRuleDefinition.builder()
                              .field("ai_tool")
                              .rules(
                                  List.of(
                                      PatternLabel.builder().pattern("bard").label("Bard").build()))
                              .exactAliases(Map.of(" BARD ", "Gemini"))
                              .numericCounts(true)
                              .ordinalLabels(Map.of(1, "Once"))
                              .countTemplate("{n}x")
                              .build()))
                  .feedbackRules(
                      List.of(
                          FeedbackRuleDefinition.builder()
                              .field("suggestions")
                              .negativeTokens(List.of(" None ", " "))
                              .build()))
                  .build());

      NormalizationRule tool = ruleSet.getValueRules().get("ai_tool");
      assertThat(tool.getExactAliases()).containsEntry("bard", "Gemini");
      assertThat(tool.displayName("Bard")).isEqualTo("Gemini");
      assertThat(tool.countLabel(1)).isEqualTo("Once");
      assertThat(tool.countLabel(4)).isEqualTo("4x");
      assertThat(ruleSet.getFeedbackRules().get("suggestions").getNegativeTokens())
          .containsExactly("none");
    }
  }

  @Nested
  @DisplayName("Invalid definitions")
  class InvalidDefinitions {

    @Test
    void shouldRejectMissingDefinition() {
      assertThatThrownBy(() -> compiler.compile(null))
          .isInstanceOf(InvalidRuleSetException.class);
    }

    @Test
    void shouldRejectDuplicateCanonicalNames() {
      RuleSetDefinition definition =
          RuleSetDefinition.builder()
              .fields(List.of(field("ai_tool", "tool"), field("ai_tool", "assistant")))
              .build();

      assertThatThrownBy(() -> compiler.compile(definition))
          .isInstanceOf(InvalidRuleSetException.class)
          .hasMessageContaining("Duplicate canonical field name: ai_tool");
    }

    @Test
    void shouldRejectInvalidRegex() {
      RuleSetDefinition definition =
          RuleSetDefinition.builder()
              .fields(List.of(field("usage_frequency", "frequency")))
              .valueRules(
                  List.of(
                      ValueRuleDefinition.builder()
                          .field("usage_frequency")
                          .rules(
                              List.of(
                                  PatternLabel.builder().pattern("(daily").label("Daily").build()))
                          .build()))
              .build();

      assertThatThrownBy(() -> compiler.compile(definition))
          .isInstanceOf(InvalidRuleSetException.class)
          .hasMessageContaining("(daily");
    }

    @Test
    void shouldRejectInvalidRegexAlias() {
      RuleSetDefinition definition =
          RuleSetDefinition.builder()
              .aliasMatchMode(AliasMatchMode.REGEX)
              .fields(List.of(field("usage_frequency", "[freq")))
              .build();

      assertThatThrownBy(() -> compiler.compile(definition))
          .isInstanceOf(InvalidRuleSetException.class);
    }

    @Test
    void shouldRejectMissingLabels() {
      RuleSetDefinition blankLabel =
          RuleSetDefinition.builder()
              .valueRules(
                  List.of(
                      ValueRuleDefinition.builder()
                          .field("usage_frequency")
                          .rules(
                              List.of(PatternLabel.builder().pattern("daily").label(" ").build()))
                          .build()))
              .build();
      RuleSetDefinition blankFallback =
          RuleSetDefinition.builder()
              .valueRules(List.of(usageRule().fallbackLabel("").build()))
              .build();

      assertThatThrownBy(() -> compiler.compile(blankLabel))
          .isInstanceOf(InvalidRuleSetException.class);
      assertThatThrownBy(() -> compiler.compile(blankFallback))
          .isInstanceOf(InvalidRuleSetException.class);
    }

    @Test
    void shouldRejectDuplicateValueRules() {
      RuleSetDefinition definition =
          RuleSetDefinition.builder()
              .valueRules(List.of(usageRule().build(), usageRule().build()))
              .build();

      assertThatThrownBy(() -> compiler.compile(definition))
          .isInstanceOf(InvalidRuleSetException.class)
          .hasMessageContaining("usage_frequency");
    }

    @Test
    void shouldRejectCategoryWithoutPatterns() {
      RuleSetDefinition definition =
          RuleSetDefinition.builder()
              .feedbackRules(
                  List.of(
                      FeedbackRuleDefinition.builder()
                          .field("suggestions")
                          .categories(
                              List.of(CategoryDefinition.builder().label("Training").build()))
                          .build()))
              .build();

      assertThatThrownBy(() -> compiler.compile(definition))
          .isInstanceOf(InvalidRuleSetException.class)
          .hasMessageContaining("Training");
    }
  }
}
