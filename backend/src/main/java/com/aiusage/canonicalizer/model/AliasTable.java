package com.aiusage.canonicalizer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.aiusage.canonicalizer.exception.InvalidRuleSetException;
import com.aiusage.canonicalizer.service.canonicalization.HeaderCanonicalizer;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Canonical field names with their ordered aliases. Declaration order is the match priority:
 * fields are scanned in list order and aliases in their declared order within a field.
 */
@Getter
public final class AliasTable {

  private final AliasMatchMode matchMode;
  private final List<FieldAliases> fields;

  @Getter(AccessLevel.NONE)
  private final Map<String, Pattern> compiledAliases;

  @Getter(AccessLevel.NONE)
  private final Map<String, String> normalizedAliases;

  private AliasTable(
      AliasMatchMode matchMode,
      List<FieldAliases> fields,
      Map<String, Pattern> compiledAliases,
      Map<String, String> normalizedAliases) {
    this.matchMode = matchMode;
    this.fields = fields;
    this.compiledAliases = compiledAliases;
    this.normalizedAliases = normalizedAliases;
  }

  public static AliasTable of(AliasMatchMode matchMode, List<FieldAliases> fields) {
    AliasMatchMode mode = matchMode != null ? matchMode : AliasMatchMode.SUBSTRING;
    List<FieldAliases> declared = fields == null ? List.of() : List.copyOf(fields);

    Set<String> seen = new LinkedHashSet<>();
    Map<String, Pattern> compiled = new HashMap<>();
    Map<String, String> normalized = new HashMap<>();

    for (FieldAliases field : declared) {
      String name = field.getCanonicalName();
      if (name == null || name.isBlank()) {
        throw new InvalidRuleSetException("Canonical field name must not be blank");
      }
      if (!seen.add(name)) {
        throw new InvalidRuleSetException("Duplicate canonical field name: " + name);
      }
      for (String alias : field.getAliases()) {
        if (alias == null || alias.isBlank()) {
          throw new InvalidRuleSetException("Blank alias declared for field '" + name + "'");
        }
        if (mode == AliasMatchMode.REGEX) {
          compiled.computeIfAbsent(alias, a -> compile(name, a));
        } else {
          String key = HeaderCanonicalizer.normalizeHeader(alias);
          if (key.isEmpty()) {
            throw new InvalidRuleSetException(
                "Alias '" + alias + "' for field '" + name + "' has no alphanumeric characters");
          }
          normalized.put(alias, key);
        }
      }
    }

    return new AliasTable(
        mode,
        declared,
        Collections.unmodifiableMap(compiled),
        Collections.unmodifiableMap(normalized));
  }

  /** Tests one declared alias against an already normalized header. */
  public boolean aliasMatches(String alias, String normalizedHeader) {
    if (matchMode == AliasMatchMode.REGEX) {
      Pattern pattern = compiledAliases.get(alias);
      return pattern != null && pattern.matcher(normalizedHeader).find();
    }
    String key = normalizedAliases.get(alias);
    return key != null && normalizedHeader.contains(key);
  }

  public List<String> canonicalNames() {
    List<String> names = new ArrayList<>(fields.size());
    for (FieldAliases field : fields) {
      names.add(field.getCanonicalName());
    }
    return names;
  }

  private static Pattern compile(String field, String alias) {
    try {
      return Pattern.compile(alias, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    } catch (PatternSyntaxException e) {
      throw new InvalidRuleSetException(
          "Invalid alias pattern '" + alias + "' for field '" + field + "': " + e.getDescription(),
          e);
    }
  }
}
