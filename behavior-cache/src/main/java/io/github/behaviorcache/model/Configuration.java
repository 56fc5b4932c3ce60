package io.github.behaviorcache.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Settings of one cache instance.
 */
@Value.Immutable
public interface Configuration {

  /**
   * Root of the persistent local cache.
   */
  Path cacheDirectory();

  /**
   * Project (top-level prefix in the bucket).
   */
  @Value.Default
  default String project() {
    return "visual-behavior-ophys";
  }

  /**
   * Bucket holding the releases.
   */
  @Value.Default
  default String bucket() {
    return "visual-behavior-ophys-data";
  }

  /**
   * Bucket region.
   */
  @Value.Default
  default String region() {
    return "us-west-2";
  }

  /**
   * A directory mirroring the bucket, used instead of S3 when set.
   */
  Optional<Path> localStoreRoot();

  /**
   * Pinned manifest version; latest when absent.
   */
  Optional<String> manifestVersion();

  /**
   * Client version checked against the compatibility table; the library version when absent.
   */
  Optional<String> clientVersion();

  /**
   * Explicit opt-out of the compatibility check, for unreleased manifests.
   */
  @Value.Default
  default boolean skipVersionCheck() {
    return false;
  }

  /**
   * Download attempts before a failure is surfaced.
   */
  @Value.Default
  default int maxDownloadAttempts() {
    return 3;
  }

  /**
   * First retry delay, doubled per attempt.
   */
  @Value.Default
  default Duration retryBackoff() {
    return Duration.ofMillis(100);
  }

  /**
   * Cache hit verification.
   */
  @Value.Default
  default VerificationMode verification() {
    return VerificationMode.DIGEST;
  }

  /**
   * Compatibility table; the bundled one when absent.
   */
  Optional<CompatibilityTable> compatibility();

  /**
   * Record types of the project.
   */
  @Value.Default
  default ProjectLayout layout() {
    return ProjectLayouts.visualBehaviorOphys();
  }

  /**
   * Sanity checks.
   */
  @Value.Check
  default void check() {
    if (maxDownloadAttempts() < 1) {
      throw new IllegalArgumentException("maxDownloadAttempts must be at least 1");
    }
    if (retryBackoff().isNegative()) {
      throw new IllegalArgumentException("retryBackoff must not be negative");
    }
  }
}
