package io.github.behaviorcache.exception;

/**
 * A record would need more than one level of indirection to reach a file identifier.
 */
public class UnsupportedIndirectionException extends BehaviorCacheException {

  /**
   * Instantiates a new Unsupported indirection exception.
   *
   * @param message the message
   */
  public UnsupportedIndirectionException(final String message) {
    super(message);
  }
}
