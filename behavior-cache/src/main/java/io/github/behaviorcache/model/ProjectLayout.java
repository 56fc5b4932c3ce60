package io.github.behaviorcache.model;

import io.github.behaviorcache.exception.UnsupportedIndirectionException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.immutables.value.Value;

/**
 * The record types of a project and the columns whose cells carry literal-encoded values.
 */
@Value.Immutable
public interface ProjectLayout {

  List<RecordType> recordTypes();

  /**
   * Columns decoded from their textual list/dict encoding, in any table that has them.
   */
  Set<String> structuredColumns();

  /**
   * Record type by name.
   *
   * @param name the name
   * @return the record type
   */
  default Optional<RecordType> recordType(final String name) {
    return recordTypes().stream().filter(type -> type.name().equals(name)).findFirst();
  }

  /**
   * The metadata tables a manifest must declare for this layout.
   *
   * @return the table names
   */
  default Set<String> tableNames() {
    final Set<String> names = new LinkedHashSet<>();
    recordTypes().forEach(type -> names.add(type.tableName()));
    return names;
  }

  /**
   * Names must be unique, references must name a declared type, and only one level of
   * indirection is supported.
   */
  @Value.Check
  default void check() {
    final Set<String> names = new LinkedHashSet<>();
    for (RecordType type : recordTypes()) {
      if (!names.add(type.name())) {
        throw new IllegalArgumentException("Duplicate record type " + type.name());
      }
    }
    for (RecordType type : recordTypes()) {
      if (type.referencedRecordType().isEmpty()) {
        continue;
      }
      final String target = type.referencedRecordType().get();
      final RecordType referenced = recordType(target)
          .orElseThrow(() -> new IllegalArgumentException(
              "Record type " + type.name() + " references undeclared type " + target));
      if (referenced.referenceColumn().isPresent()) {
        throw new UnsupportedIndirectionException(
            "Record type " + type.name() + " references " + target
                + ", which is itself indirect; only one level of indirection is supported");
      }
    }
  }
}
