package com.aiusage.canonicalizer.service.canonicalization;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.aiusage.canonicalizer.model.AliasTable;
import com.aiusage.canonicalizer.model.CanonicalTable;
import com.aiusage.canonicalizer.model.CanonicalizationResult;
import com.aiusage.canonicalizer.model.HeaderMapping;
import com.aiusage.canonicalizer.model.HeaderResolution;
import com.aiusage.canonicalizer.model.RawTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Renames the columns of a whole table: header canonicalization, then collision resolution, then
 * rows re-keyed by the final names. Values and row order are untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableCanonicalizationService {

  private final HeaderCanonicalizer headerCanonicalizer;
  private final CollisionResolver collisionResolver;

  public HeaderResolution resolveHeaders(List<String> headers, AliasTable aliasTable) {
    List<HeaderMapping> mappings = headerCanonicalizer.match(headers, aliasTable);

    List<String> proposed = new ArrayList<>(mappings.size());
    for (HeaderMapping mapping : mappings) {
      proposed.add(mapping.getProposed());
    }

    List<String> resolved = collisionResolver.resolve(proposed);
    for (int i = 0; i < mappings.size(); i++) {
      mappings.get(i).setCanonical(resolved.get(i));
    }

    return HeaderResolution.builder()
        .originalHeaders(new ArrayList<>(headers))
        .canonicalHeaders(resolved)
        .mapping(mappings)
        .build();
  }

  public CanonicalizationResult canonicalize(RawTable rawTable, AliasTable aliasTable) {
    HeaderResolution resolution = resolveHeaders(rawTable.getHeaders(), aliasTable);
    List<String> names = resolution.getCanonicalHeaders();

    // First occurrence of each final name wins. The resolver already guarantees uniqueness.
    Set<String> kept = new LinkedHashSet<>();
    List<Integer> keptPositions = new ArrayList<>();
    for (int i = 0; i < names.size(); i++) {
      if (kept.add(names.get(i))) {
        keptPositions.add(i);
      } else {
        log.warn("Dropping duplicate column '{}' at position {}", names.get(i), i);
      }
    }

    List<Map<String, Object>> rows = new ArrayList<>(rawTable.rowCount());
    for (List<Object> rawRow : rawTable.getRows()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int position : keptPositions) {
        row.put(names.get(position), rawRow.get(position));
      }
      rows.add(row);
    }

    long recognized = resolution.getMapping().stream().filter(HeaderMapping::isRecognized).count();
    log.info(
        "Canonicalized {} columns ({} recognized) over {} rows",
        names.size(),
        recognized,
        rows.size());

    return new CanonicalizationResult(new CanonicalTable(new ArrayList<>(kept), rows), resolution);
  }
}
