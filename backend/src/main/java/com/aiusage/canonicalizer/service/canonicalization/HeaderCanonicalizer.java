package com.aiusage.canonicalizer.service.canonicalization;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.aiusage.canonicalizer.model.AliasTable;
import com.aiusage.canonicalizer.model.FieldAliases;
import com.aiusage.canonicalizer.model.HeaderMapping;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps raw column headers to canonical field names.
 *
 * <p>Headers are compared in normalized form: lower-cased with every character that is not a
 * letter or digit removed, so "AI Tool-Used", "ai_tool_used" and "aitoolused" are equivalent.
 * Matching order for one header:
 *
 * <ol>
 *   <li>a header that already is a canonical name (or such a name with a collision suffix
 *       {@code _N}) keeps that field, which makes canonicalization idempotent;
 *   <li>fields in declaration order, each field's aliases in declaration order, then the field's
 *       legacy names (exact normalized equality). The first match wins.
 * </ol>
 *
 * Headers that match nothing pass through verbatim. Blank headers become {@code column_<n>}.
 */
@Slf4j
@Component
public class HeaderCanonicalizer {

  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{Nd}]+");
  private static final Pattern COLLISION_SUFFIX = Pattern.compile("^(.+)_(\\d+)$");

  public static String normalizeHeader(String header) {
    if (header == null) {
      return "";
    }
    return NON_ALPHANUMERIC.matcher(header.toLowerCase(Locale.ROOT)).replaceAll("");
  }

  /** One canonical-or-passthrough name per header, in input order. */
  public List<String> canonicalize(List<String> headers, AliasTable aliasTable) {
    List<String> names = new ArrayList<>(headers.size());
    for (HeaderMapping mapping : match(headers, aliasTable)) {
      names.add(mapping.getProposed());
    }
    return names;
  }

  /** Same as {@link #canonicalize} but keeps which alias matched, for the debug payload. */
  public List<HeaderMapping> match(List<String> headers, AliasTable aliasTable) {
    List<HeaderMapping> mappings = new ArrayList<>(headers.size());
    for (int i = 0; i < headers.size(); i++) {
      mappings.add(matchHeader(headers.get(i), i, aliasTable));
    }
    return mappings;
  }

  public HeaderMapping matchHeader(String header, int position, AliasTable aliasTable) {
    if (header == null || header.isBlank()) {
      String generated = "column_" + (position + 1);
      log.debug("Blank header at position {} renamed to {}", position, generated);
      return passthrough(header, generated, position);
    }

    String normalized = normalizeHeader(header);

    FieldAliases identity = findCanonicalIdentity(header, normalized, aliasTable);
    if (identity != null) {
      return recognized(header, position, identity.getCanonicalName(), identity.getCanonicalName());
    }

    for (FieldAliases field : aliasTable.getFields()) {
      for (String alias : field.getAliases()) {
        if (aliasTable.aliasMatches(alias, normalized)) {
          log.debug(
              "Header '{}' matched alias '{}' of field {}",
              header,
              alias,
              field.getCanonicalName());
          return recognized(header, position, field.getCanonicalName(), alias);
        }
      }
      for (String legacyName : field.getLegacyNames()) {
        if (normalized.equals(normalizeHeader(legacyName))) {
          log.debug(
              "Header '{}' matched legacy name of field {}", header, field.getCanonicalName());
          return recognized(header, position, field.getCanonicalName(), legacyName);
        }
      }
    }

    log.debug("Header '{}' matched no alias, passing through", header);
    return passthrough(header, header, position);
  }

  private FieldAliases findCanonicalIdentity(
      String header, String normalized, AliasTable aliasTable) {
    for (FieldAliases field : aliasTable.getFields()) {
      if (normalized.equals(normalizeHeader(field.getCanonicalName()))) {
        return field;
      }
    }
    Matcher suffixed = COLLISION_SUFFIX.matcher(header.trim());
    if (suffixed.matches() && isCollisionSuffix(suffixed.group(2))) {
      for (FieldAliases field : aliasTable.getFields()) {
        if (field.getCanonicalName().equalsIgnoreCase(suffixed.group(1))) {
          return field;
        }
      }
    }
    return null;
  }

  private boolean isCollisionSuffix(String digits) {
    try {
      return Integer.parseInt(digits) >= CollisionResolver.FIRST_SUFFIX;
    } catch (NumberFormatException e) {
      // more digits than an int holds, not one of ours
      return false;
    }
  }

  private HeaderMapping recognized(String header, int position, String canonical, String alias) {
    return HeaderMapping.builder()
        .position(position)
        .original(header)
        .proposed(canonical)
        .matchedAlias(alias)
        .recognized(true)
        .build();
  }

  private HeaderMapping passthrough(String header, String name, int position) {
    return HeaderMapping.builder()
        .position(position)
        .original(header)
        .proposed(name)
        .recognized(false)
        .build();
  }
}
