package com.aiusage.canonicalizer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.ToString;

/** Ordered alias patterns and exact legacy names accepted for one canonical field. */
@Getter
@ToString
public final class FieldAliases {

  private final String canonicalName;
  private final List<String> aliases;
  private final List<String> legacyNames;

  public FieldAliases(String canonicalName, List<String> aliases, List<String> legacyNames) {
    this.canonicalName = canonicalName;
    this.aliases = copy(aliases);
    this.legacyNames = copy(legacyNames);
  }

  public FieldAliases(String canonicalName, List<String> aliases) {
    this(canonicalName, aliases, List.of());
  }

  private static List<String> copy(List<String> names) {
    return names == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(names));
  }
}
