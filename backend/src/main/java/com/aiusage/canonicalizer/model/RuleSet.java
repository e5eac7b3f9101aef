package com.aiusage.canonicalizer.model;

import java.util.Map;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/** Compiled, immutable canonicalization configuration shared by all analyses. */
@Getter
@Builder
@ToString
public final class RuleSet {

  private final String version;

  private final AliasTable aliasTable;

  /** Keyed by canonical field name, in declaration order. */
  @Singular("valueRule") private final Map<String, NormalizationRule> valueRules;

  /** Keyed by canonical field name, in declaration order. */
  @Singular("feedbackRule") private final Map<String, ClassificationRule> feedbackRules;
}
