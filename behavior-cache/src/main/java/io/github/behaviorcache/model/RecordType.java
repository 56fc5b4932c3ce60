package io.github.behaviorcache.model;

import io.github.behaviorcache.table.RowNormalizer;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One kind of record a project exposes, and the table that lists it.
 */
@Value.Immutable
public interface RecordType {

  /**
   * Record type name, e.g. "ophys_experiment".
   */
  String name();

  /**
   * Metadata table name, e.g. "ophys_experiment_table".
   */
  String tableName();

  /**
   * Integer column unique within the table.
   */
  String primaryKeyColumn();

  /**
   * Column listing the ids of artifact-bearing records when the row has no file of its own.
   */
  Optional<String> referenceColumn();

  /**
   * Record type those ids belong to.
   */
  Optional<String> referencedRecordType();

  /**
   * Columns dropped after normalization.
   */
  List<String> suppressedColumns();

  /**
   * Record-type specific step run after the structured column decoding.
   */
  @Value.Default
  default RowNormalizer normalizer() {
    return RowNormalizer.identity();
  }

  /**
   * Reference column and referenced type come as a pair.
   */
  @Value.Check
  default void check() {
    if (referenceColumn().isPresent() != referencedRecordType().isPresent()) {
      throw new IllegalArgumentException(
          "Record type " + name() + " must set both referenceColumn and referencedRecordType");
    }
  }
}
