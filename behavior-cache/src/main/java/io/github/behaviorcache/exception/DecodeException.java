package io.github.behaviorcache.exception;

/**
 * A metadata table cell could not be decoded. Fatal for the whole table load.
 */
public class DecodeException extends BehaviorCacheException {

  /**
   * Instantiates a new Decode exception.
   *
   * @param message the message
   */
  public DecodeException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Decode exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DecodeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
