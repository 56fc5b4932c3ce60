package io.github.behaviorcache.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.time.Instant;
import org.immutables.value.Value;

/**
 * Sidecar record of a verified download, stored next to the artifact.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableCacheEntry.class)
@JsonDeserialize(as = ImmutableCacheEntry.class)
public interface CacheEntry {

  /**
   * File identifier.
   */
  String fileId();

  /**
   * File name inside the entry directory.
   */
  String fileName();

  /**
   * Size in bytes at install time.
   */
  long size();

  /**
   * Digest algorithm.
   */
  String algorithm();

  /**
   * Lowercase hex digest at install time.
   */
  String digest();

  /**
   * Manifest version active when the file was downloaded.
   */
  String manifestVersion();

  /**
   * Install time.
   */
  Instant downloadedAt();
}
