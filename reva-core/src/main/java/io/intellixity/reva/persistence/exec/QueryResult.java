package io.intellixity.reva.persistence.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Raw outcome of {@link Runner#query(String)}.\n
 *
 * @param rows rows returned by the statement (empty for statements that do not produce a result set)\n
 * @param updateCount affected row count, or -1 when the statement produced rows\n
 */
public record QueryResult(List<Map<String, Object>> rows, long updateCount) {
  public QueryResult {
    rows = (rows == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(rows));
  }

  public static QueryResult ofRows(List<Map<String, Object>> rows) {
    return new QueryResult(rows, -1);
  }

  public static QueryResult ofUpdateCount(long updateCount) {
    return new QueryResult(List.of(), updateCount);
  }

  public boolean hasRows() {
    return !rows.isEmpty();
  }
}
