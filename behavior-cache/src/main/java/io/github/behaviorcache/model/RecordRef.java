package io.github.behaviorcache.model;

import org.immutables.value.Value;

/**
 * Pointer from one row to a row of another record type.
 */
@Value.Immutable
public interface RecordRef {

  /**
   * Referenced record type.
   */
  @Value.Parameter
  String recordType();

  /**
   * Primary identifier in the referenced table.
   */
  @Value.Parameter
  long recordId();
}
