package com.aiusage.canonicalizer.model;

/** How alias patterns of an {@link AliasTable} are tested against a normalized header. */
public enum AliasMatchMode {
  /** Alias is normalized like a header and must be contained in the normalized header. */
  SUBSTRING,
  /** Alias is a case-insensitive regular expression searched in the normalized header. */
  REGEX
}
