package io.github.behaviorcache.exception;

/**
 * More than one row carries the same primary identifier in a table. This is a manifest integrity
 * problem, not a caller error.
 */
public class AmbiguousRecordException extends BehaviorCacheException {

  private final String tableName;
  private final long recordId;
  private final int matches;

  /**
   * Instantiates a new Ambiguous record exception.
   *
   * @param tableName the table name
   * @param recordId  the record id
   * @param matches   how many rows matched
   */
  public AmbiguousRecordException(final String tableName, final long recordId, final int matches) {
    super(String.format("Table %s should have 1 and only 1 row for id %d, found %d",
        tableName, recordId, matches));
    this.tableName = tableName;
    this.recordId = recordId;
    this.matches = matches;
  }

  public String tableName() {
    return tableName;
  }

  public long recordId() {
    return recordId;
  }

  public int matches() {
    return matches;
  }
}
