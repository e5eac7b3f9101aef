package com.aiusage.canonicalizer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;

/**
 * A parsed table of unknown shape. Headers are kept positionally so that duplicate raw headers
 * survive until collision resolution; every row has exactly one cell per header.
 */
@Getter
public final class RawTable {

  private final String sourceName;
  private final List<String> headers;
  private final List<List<Object>> rows;

  public RawTable(String sourceName, List<String> headers, List<List<Object>> rows) {
    this.sourceName = sourceName;
    this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
    List<List<Object>> copy = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      copy.add(Collections.unmodifiableList(fit(row, this.headers.size())));
    }
    this.rows = Collections.unmodifiableList(copy);
  }

  public int rowCount() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  private static List<Object> fit(List<Object> row, int width) {
    List<Object> cells = new ArrayList<>(width);
    for (int i = 0; i < width; i++) {
      cells.add(row != null && i < row.size() ? row.get(i) : null);
    }
    return cells;
  }
}
