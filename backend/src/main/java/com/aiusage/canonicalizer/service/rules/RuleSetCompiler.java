package com.aiusage.canonicalizer.service.rules;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.springframework.stereotype.Component;

import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition.CategoryDefinition;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition.FeedbackRuleDefinition;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition.FieldDefinition;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition.PatternLabel;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition.ValueRuleDefinition;
import com.aiusage.canonicalizer.exception.InvalidRuleSetException;
import com.aiusage.canonicalizer.model.AliasTable;
import com.aiusage.canonicalizer.model.CategoryPattern;
import com.aiusage.canonicalizer.model.ClassificationRule;
import com.aiusage.canonicalizer.model.FieldAliases;
import com.aiusage.canonicalizer.model.NormalizationRule;
import com.aiusage.canonicalizer.model.RuleSet;
import com.aiusage.canonicalizer.model.ValuePattern;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a {@link RuleSetDefinition} into an immutable {@link RuleSet}: regular expressions are
 * compiled case-insensitively, tokens and alias keys are lower-cased, unset labels get their
 * defaults. Any inconsistency is reported as {@link InvalidRuleSetException}.
 */
@Slf4j
@Component
public class RuleSetCompiler {

  private static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  public RuleSet compile(RuleSetDefinition definition) {
    if (definition == null) {
      throw new InvalidRuleSetException("Rule set definition is missing");
    }

    AliasTable aliasTable =
        AliasTable.of(definition.getAliasMatchMode(), compileFields(definition.getFields()));

    RuleSet.RuleSetBuilder builder =
        RuleSet.builder().version(definition.getVersion()).aliasTable(aliasTable);

    Set<String> valueFields = new HashSet<>();
    for (ValueRuleDefinition valueRule : nullSafe(definition.getValueRules())) {
      NormalizationRule rule = compileValueRule(valueRule);
      if (!valueFields.add(rule.getField())) {
        throw new InvalidRuleSetException("Duplicate value rules for field: " + rule.getField());
      }
      builder.valueRule(rule.getField(), rule);
    }

    Set<String> feedbackFields = new HashSet<>();
    for (FeedbackRuleDefinition feedbackRule : nullSafe(definition.getFeedbackRules())) {
      ClassificationRule rule = compileFeedbackRule(feedbackRule);
      if (!feedbackFields.add(rule.getField())) {
        throw new InvalidRuleSetException(
            "Duplicate feedback rules for field: " + rule.getField());
      }
      builder.feedbackRule(rule.getField(), rule);
    }

    RuleSet ruleSet = builder.build();
    log.debug(
        "Compiled rule set {}: {} fields, {} value rules, {} feedback rules",
        ruleSet.getVersion(),
        aliasTable.getFields().size(),
        ruleSet.getValueRules().size(),
        ruleSet.getFeedbackRules().size());
    return ruleSet;
  }

  private List<FieldAliases> compileFields(List<FieldDefinition> fields) {
    List<FieldAliases> compiled = new ArrayList<>();
    for (FieldDefinition field : nullSafe(fields)) {
      compiled.add(
          new FieldAliases(
              field.getCanonical(),
              nullSafe(field.getAliases()),
              nullSafe(field.getLegacyNames())));
    }
    return compiled;
  }

  private NormalizationRule compileValueRule(ValueRuleDefinition definition) {
    String field = requireText(definition.getField(), "Value rule without field");
    NormalizationRule.NormalizationRuleBuilder builder =
        NormalizationRule.builder()
            .field(field)
            .numericCounts(Boolean.TRUE.equals(definition.getNumericCounts()));

    for (PatternLabel rule : nullSafe(definition.getRules())) {
      String label = requireText(rule.getLabel(), "Value rule for '" + field + "' without label");
      builder.pattern(new ValuePattern(compilePattern(field, rule.getPattern()), label));
    }
    if (definition.getFallbackLabel() != null) {
      builder.fallbackLabel(requireText(definition.getFallbackLabel(), "Blank fallback label"));
    }
    if (definition.getMissingLabel() != null) {
      builder.missingLabel(requireText(definition.getMissingLabel(), "Blank missing label"));
    }
    if (definition.getCountTemplate() != null) {
      builder.countTemplate(definition.getCountTemplate());
    }
    if (definition.getOrdinalLabels() != null) {
      builder.ordinalLabels(definition.getOrdinalLabels());
    }
    if (definition.getExactAliases() != null) {
      for (Map.Entry<String, String> alias : definition.getExactAliases().entrySet()) {
        builder.exactAlias(
            alias.getKey().trim().toLowerCase(Locale.ROOT),
            requireText(alias.getValue(), "Blank display name for alias " + alias.getKey()));
      }
    }
    return builder.build();
  }

  private ClassificationRule compileFeedbackRule(FeedbackRuleDefinition definition) {
    String field = requireText(definition.getField(), "Feedback rule without field");
    ClassificationRule.ClassificationRuleBuilder builder =
        ClassificationRule.builder().field(field);

    for (String token : nullSafe(definition.getNegativeTokens())) {
      if (token != null && !token.isBlank()) {
        builder.negativeToken(token.trim().toLowerCase(Locale.ROOT));
      }
    }
    for (CategoryDefinition category : nullSafe(definition.getCategories())) {
      String label =
          requireText(category.getLabel(), "Feedback category for '" + field + "' without label");
      List<Pattern> patterns = new ArrayList<>();
      for (String pattern : nullSafe(category.getPatterns())) {
        patterns.add(compilePattern(field, pattern));
      }
      if (patterns.isEmpty()) {
        throw new InvalidRuleSetException("Feedback category '" + label + "' has no patterns");
      }
      builder.category(new CategoryPattern(label, patterns));
    }
    if (definition.getNoSuggestionsLabel() != null) {
      builder.noSuggestionsLabel(
          requireText(definition.getNoSuggestionsLabel(), "Blank no-suggestions label"));
    }
    if (definition.getCatchAllLabel() != null) {
      builder.catchAllLabel(requireText(definition.getCatchAllLabel(), "Blank catch-all label"));
    }
    return builder.build();
  }

  private Pattern compilePattern(String field, String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      throw new InvalidRuleSetException("Empty pattern in rules for field '" + field + "'");
    }
    try {
      return Pattern.compile(pattern, PATTERN_FLAGS);
    } catch (PatternSyntaxException e) {
      throw new InvalidRuleSetException(
          "Invalid pattern '" + pattern + "' for field '" + field + "': " + e.getDescription(), e);
    }
  }

  private String requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new InvalidRuleSetException(message);
    }
    return value.trim();
  }

  private static <T> List<T> nullSafe(List<T> list) {
    return list == null ? List.of() : list;
  }
}
