package com.rhythm360.monitor.exports;

import java.util.List;

/** Rows plus their type, so the header can be written even when there are no rows. */
public record CsvDocument<T>(Class<T> rowType, List<T> rows) {

  public CsvDocument {
    rows = List.copyOf(rows);
  }
}
