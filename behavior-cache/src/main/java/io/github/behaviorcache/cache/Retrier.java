package io.github.behaviorcache.cache;

import io.github.behaviorcache.exception.DownloadException;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with exponential backoff for retryable {@link DownloadException}s. Anything else
 * propagates on the first failure.
 */
public class Retrier {

  private static final Logger log = LoggerFactory.getLogger(Retrier.class);

  private final int maxAttempts;
  private final Duration backoff;

  /**
   * Instantiates a new Retrier.
   *
   * @param maxAttempts total attempts, at least 1
   * @param backoff     delay before the first retry, doubled after each
   */
  public Retrier(final int maxAttempts, final Duration backoff) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.maxAttempts = maxAttempts;
    this.backoff = backoff;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Call with retries.
   *
   * @param description what is being attempted, for logs and errors
   * @param action      the action
   * @param <T>         result type
   * @return the result
   * @throws DownloadException non-retryable once attempts are exhausted
   */
  public <T> T call(final String description, final Supplier<T> action) {
    DownloadException last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return action.get();
      } catch (DownloadException e) {
        if (!e.isRetryable()) {
          throw e;
        }
        last = e;
        if (attempt < maxAttempts) {
          final long delay = backoff.toMillis() * (1L << (attempt - 1));
          log.warn("{} failed ({}), retrying ({}/{}) in {} ms",
              description, e.getMessage(), attempt, maxAttempts, delay);
          sleep(delay, description);
        }
      }
    }
    log.error("{} failed after {} attempts", description, maxAttempts);
    throw new DownloadException(
        description + " failed after " + maxAttempts + " attempts", last, false);
  }

  /**
   * Run with retries.
   *
   * @param description what is being attempted
   * @param action      the action
   */
  public void run(final String description, final Runnable action) {
    call(description, () -> {
      action.run();
      return null;
    });
  }

  private static void sleep(final long millis, final String description) {
    if (millis <= 0) {
      return;
    }
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DownloadException(description + " interrupted", e, false);
    }
  }
}
