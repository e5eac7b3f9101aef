package com.aiusage.canonicalizer.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Canonical table plus the header resolution that produced it. */
@Getter
@AllArgsConstructor
public final class CanonicalizationResult {

  private final CanonicalTable table;
  private final HeaderResolution resolution;
}
