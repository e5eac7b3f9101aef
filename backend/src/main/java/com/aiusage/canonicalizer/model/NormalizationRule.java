package com.aiusage.canonicalizer.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Ordered value patterns for one canonical field. Patterns are tried top to bottom and the first
 * match wins. Unmatched values get {@link #getFallbackLabel()}, blank or absent cells get {@link
 * #getMissingLabel()}.
 */
@Getter
@Builder
@ToString
public final class NormalizationRule {

  public static final String DEFAULT_FALLBACK_LABEL = "Other";
  public static final String DEFAULT_MISSING_LABEL = "Unknown";
  public static final String DEFAULT_COUNT_TEMPLATE = "{n} times";

  private final String field;

  @Singular("pattern") private final List<ValuePattern> patterns;

  @Builder.Default private final String fallbackLabel = DEFAULT_FALLBACK_LABEL;

  @Builder.Default private final String missingLabel = DEFAULT_MISSING_LABEL;

  /** When set, wholly numeric cells are read as a count and skip the textual patterns. */
  private final boolean numericCounts;

  /** Count to label, e.g. 1 to "Once". Counts absent here use {@link #getCountTemplate()}. */
  @Singular("ordinalLabel") private final Map<Integer, String> ordinalLabels;

  @Builder.Default private final String countTemplate = DEFAULT_COUNT_TEMPLATE;

  /** Lower-cased, trimmed label to display name, applied after pattern lookup. */
  @Singular("exactAlias") private final Map<String, String> exactAliases;

  /** Labels in the order they should appear in a distribution. */
  public List<String> declaredLabels() {
    Set<String> labels = new LinkedHashSet<>();
    for (ValuePattern pattern : patterns) {
      labels.add(displayName(pattern.getLabel()));
    }
    return new ArrayList<>(labels);
  }

  public String countLabel(int count) {
    String ordinal = ordinalLabels.get(count);
    return ordinal != null ? ordinal : countTemplate.replace("{n}", String.valueOf(count));
  }

  public String displayName(String label) {
    if (label == null) {
      return null;
    }
    String alias = exactAliases.get(label.trim().toLowerCase(Locale.ROOT));
    return alias != null ? alias : label;
  }
}
