package io.github.behaviorcache.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * A loaded metadata table. Never mutated after construction, so it may be shared between
 * threads.
 */
public final class MetadataTable {

  private final String name;
  private final String recordType;
  private final String manifestVersion;
  private final List<String> columns;
  private final List<MetadataRow> rows;
  private final Map<Long, List<MetadataRow>> rowsById;

  /**
   * Instantiates a new Metadata table.
   *
   * @param name            the table name
   * @param recordType      the record type the rows describe
   * @param manifestVersion the manifest version it was loaded from
   * @param columns         the columns, in order
   * @param rows            the rows, in file order
   */
  public MetadataTable(final String name, final String recordType, final String manifestVersion,
                       final List<String> columns, final List<MetadataRow> rows) {
    this.name = name;
    this.recordType = recordType;
    this.manifestVersion = manifestVersion;
    this.columns = List.copyOf(columns);
    this.rows = List.copyOf(rows);
    final Map<Long, List<MetadataRow>> index = new HashMap<>();
    for (MetadataRow row : this.rows) {
      index.computeIfAbsent(row.id(), id -> new ArrayList<>(1)).add(row);
    }
    index.replaceAll((id, matches) -> Collections.unmodifiableList(matches));
    this.rowsById = Collections.unmodifiableMap(index);
  }

  public String name() {
    return name;
  }

  public String recordType() {
    return recordType;
  }

  public String manifestVersion() {
    return manifestVersion;
  }

  public List<String> columns() {
    return columns;
  }

  public List<MetadataRow> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public Stream<MetadataRow> stream() {
    return rows.stream();
  }

  /**
   * All rows with the given primary identifier. A well formed table returns at most one.
   *
   * @param id the id
   * @return the matching rows
   */
  public List<MetadataRow> find(final long id) {
    return rowsById.getOrDefault(id, List.of());
  }

  /**
   * Values of one column, in row order.
   *
   * @param column the column
   * @return the values, nulls included
   */
  public List<Object> column(final String column) {
    final List<Object> values = new ArrayList<>(rows.size());
    rows.forEach(row -> values.add(row.get(column)));
    return Collections.unmodifiableList(values);
  }

  @Override
  public String toString() {
    return "MetadataTable{" + name + " v" + manifestVersion + ", " + rows.size() + " rows}";
  }
}
