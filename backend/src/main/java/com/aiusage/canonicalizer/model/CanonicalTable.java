package com.aiusage.canonicalizer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.aiusage.canonicalizer.exception.MissingRequiredFieldException;

import lombok.Getter;

/** Rows keyed by unique canonical or passthrough names, same row order as the raw table. */
@Getter
public final class CanonicalTable {

  private final List<String> headers;
  private final List<Map<String, Object>> rows;

  public CanonicalTable(List<String> headers, List<Map<String, Object>> rows) {
    this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
    this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
  }

  public int rowCount() {
    return rows.size();
  }

  public boolean hasColumn(String field) {
    return headers.contains(field);
  }

  /**
   * Values of one column in row order.
   *
   * @throws MissingRequiredFieldException if the table has no such column
   */
  public List<Object> requireColumn(String field) {
    if (!hasColumn(field)) {
      throw new MissingRequiredFieldException(field, headers);
    }
    List<Object> values = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      values.add(row.get(field));
    }
    return values;
  }
}
