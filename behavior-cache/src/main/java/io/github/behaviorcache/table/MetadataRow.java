package io.github.behaviorcache.table;

import io.github.behaviorcache.model.ArtifactLocation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One decoded, read-only row of a metadata table.
 */
public final class MetadataRow {

  private final long id;
  private final Map<String, Object> values;
  private final ArtifactLocation location;

  /**
   * Instantiates a new Metadata row.
   *
   * @param id       the primary identifier
   * @param values   the decoded values
   * @param location where the row's artifact lives
   */
  public MetadataRow(final long id, final Map<String, Object> values,
                     final ArtifactLocation location) {
    this.id = id;
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    this.location = location;
  }

  public long id() {
    return id;
  }

  public Map<String, Object> values() {
    return values;
  }

  public ArtifactLocation location() {
    return location;
  }

  /**
   * Cell value.
   *
   * @param column the column
   * @return the value, null for missing or null cells
   */
  public Object get(final String column) {
    return values.get(column);
  }

  /**
   * Non-null cell value.
   *
   * @param column the column
   * @return the value
   */
  public Optional<Object> find(final String column) {
    return Optional.ofNullable(values.get(column));
  }

  @Override
  public String toString() {
    return "MetadataRow{id=" + id + ", location=" + location + ", values=" + values + '}';
  }
}
