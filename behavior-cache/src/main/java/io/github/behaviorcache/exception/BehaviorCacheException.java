package io.github.behaviorcache.exception;

/**
 * Base type of every failure surfaced by the cache layer.
 */
public class BehaviorCacheException extends RuntimeException {

  /**
   * Instantiates a new Behavior cache exception.
   *
   * @param message the message
   */
  public BehaviorCacheException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Behavior cache exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public BehaviorCacheException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether repeating the same call may succeed.
   *
   * @return false unless the subtype says otherwise
   */
  public boolean isRetryable() {
    return false;
  }
}
