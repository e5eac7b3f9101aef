package com.aiusage.canonicalizer.model;

import java.util.List;
import java.util.regex.Pattern;

import lombok.Getter;
import lombok.ToString;

/** A feedback category and the keyword patterns that select it. */
@Getter
@ToString
public final class CategoryPattern {

  private final String label;
  private final List<Pattern> patterns;

  public CategoryPattern(String label, List<Pattern> patterns) {
    this.label = label;
    this.patterns = List.copyOf(patterns);
  }

  public boolean matches(String normalizedText) {
    for (Pattern pattern : patterns) {
      if (pattern.matcher(normalizedText).find()) {
        return true;
      }
    }
    return false;
  }
}
