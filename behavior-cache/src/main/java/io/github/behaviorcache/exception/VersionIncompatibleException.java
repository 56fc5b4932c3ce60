package io.github.behaviorcache.exception;

/**
 * The data described by a manifest cannot be read by the running client version.
 */
public class VersionIncompatibleException extends BehaviorCacheException {

  /**
   * Instantiates a new Version incompatible exception.
   *
   * @param message the message
   */
  public VersionIncompatibleException(final String message) {
    super(message);
  }
}
