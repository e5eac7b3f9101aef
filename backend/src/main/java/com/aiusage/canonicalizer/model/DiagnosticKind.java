package com.aiusage.canonicalizer.model;

public enum DiagnosticKind {
  MISSING_REQUIRED_FIELD,
  MISSING_RULE,
  UNCLASSIFIABLE_VALUE,
  UNCLASSIFIABLE_TEXT
}
