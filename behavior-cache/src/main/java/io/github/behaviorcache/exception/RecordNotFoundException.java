package io.github.behaviorcache.exception;

/**
 * No row, or no downloadable artifact, for a record identifier.
 */
public class RecordNotFoundException extends NotFoundException {

  private final String recordType;
  private final long recordId;

  /**
   * Instantiates a new Record not found exception.
   *
   * @param recordType the record type
   * @param recordId   the record id
   * @param detail     what was missing
   */
  public RecordNotFoundException(final String recordType, final long recordId, final String detail) {
    super(String.format("%s %d: %s", recordType, recordId, detail));
    this.recordType = recordType;
    this.recordId = recordId;
  }

  public String recordType() {
    return recordType;
  }

  public long recordId() {
    return recordId;
  }
}
