package com.aiusage.canonicalizer.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Ordered, mutually exclusive feedback categories for one free-text field. Negative tokens are
 * checked before any category.
 */
@Getter
@Builder
@ToString
public final class ClassificationRule {

  public static final String DEFAULT_NO_SUGGESTIONS_LABEL = "No suggestions";
  public static final String DEFAULT_CATCH_ALL_LABEL = "Other";

  private final String field;

  /** Lower-cased, trimmed tokens such as "none" or "n/a". */
  @Singular("negativeToken") private final List<String> negativeTokens;

  @Builder.Default private final String noSuggestionsLabel = DEFAULT_NO_SUGGESTIONS_LABEL;

  @Singular("category") private final List<CategoryPattern> categories;

  @Builder.Default private final String catchAllLabel = DEFAULT_CATCH_ALL_LABEL;

  /** Every label this rule can produce, in distribution order. */
  public List<String> declaredLabels() {
    Set<String> labels = new LinkedHashSet<>();
    for (CategoryPattern category : categories) {
      labels.add(category.getLabel());
    }
    labels.add(noSuggestionsLabel);
    labels.add(catchAllLabel);
    return new ArrayList<>(labels);
  }
}
