package com.aiusage.canonicalizer.model;

import java.util.regex.Pattern;

import lombok.Getter;
import lombok.ToString;

/** One (pattern, label) pair of a {@link NormalizationRule}. */
@Getter
@ToString
public final class ValuePattern {

  private final Pattern pattern;
  private final String label;

  public ValuePattern(Pattern pattern, String label) {
    this.pattern = pattern;
    this.label = label;
  }

  public boolean matches(String normalizedValue) {
    return pattern.matcher(normalizedValue).find();
  }
}
