package io.github.behaviorcache.exception;

/**
 * Unknown project, manifest version, metadata table or data file.
 */
public class NotFoundException extends BehaviorCacheException {

  /**
   * Instantiates a new Not found exception.
   *
   * @param message the message
   */
  public NotFoundException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Not found exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public NotFoundException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
