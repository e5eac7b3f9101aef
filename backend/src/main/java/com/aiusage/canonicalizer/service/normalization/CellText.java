package com.aiusage.canonicalizer.service.normalization;

import java.math.BigDecimal;

/** Textual form of a table cell as used for matching. */
public final class CellText {

  private CellText() {}

  /**
   * Returns the trimmed text of a scalar cell, or null for absent and non-scalar values (nested
   * objects, arrays), which callers treat as empty.
   */
  public static String of(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof BigDecimal) {
      return ((BigDecimal) value).stripTrailingZeros().toPlainString();
    }
    if (value instanceof CharSequence
        || value instanceof Number
        || value instanceof Boolean
        || value instanceof Character) {
      return value.toString().trim();
    }
    return null;
  }

  public static boolean isBlank(String text) {
    return text == null || text.isEmpty();
  }
}
