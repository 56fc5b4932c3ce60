package io.github.behaviorcache.exception;

/**
 * Transient failure talking to the object store.
 */
public class DownloadException extends BehaviorCacheException {

  private final boolean retryable;

  /**
   * Instantiates a retryable download exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DownloadException(final String message, final Throwable cause) {
    this(message, cause, true);
  }

  /**
   * Instantiates a new Download exception.
   *
   * @param message   the message
   * @param cause     the cause
   * @param retryable false once retries are exhausted
   */
  public DownloadException(final String message, final Throwable cause, final boolean retryable) {
    super(message, cause);
    this.retryable = retryable;
  }

  @Override
  public boolean isRetryable() {
    return retryable;
  }
}
