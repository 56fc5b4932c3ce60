package io.github.behaviorcache.model;

/**
 * How a cache hit is checked before it is served.
 */
public enum VerificationMode {
  /**
   * Compare the file size with the cache entry.
   */
  SIZE,

  /**
   * Compare size and recompute the digest.
   */
  DIGEST
}
