package io.github.behaviorcache.table;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One step of the normalization applied to every row of a metadata table while it loads. Steps
 * receive a mutable row and return the row to pass on, which may be the same instance.
 */
@FunctionalInterface
public interface RowNormalizer {

  /**
   * Normalize a row.
   *
   * @param row column name to value, values may be null
   * @return the normalized row
   */
  Map<String, Object> normalize(Map<String, Object> row);

  /**
   * Run this step, then {@code next}.
   *
   * @param next the next step
   * @return the composed normalizer
   */
  default RowNormalizer andThen(final RowNormalizer next) {
    return row -> next.normalize(normalize(row));
  }

  /**
   * No-op.
   *
   * @return the row normalizer
   */
  static RowNormalizer identity() {
    return row -> row;
  }

  /**
   * Drops the given columns when present.
   *
   * @param columns the columns
   * @return the row normalizer
   */
  static RowNormalizer dropColumns(final Collection<String> columns) {
    final List<String> copy = List.copyOf(columns);
    return row -> {
      copy.forEach(row::remove);
      return row;
    };
  }
}
