package io.github.behaviorcache.store;

import io.github.behaviorcache.exception.DecodeException;
import java.util.Optional;

/**
 * Bucket and key parsed from a manifest url.
 */
public final class ObjectLocation {

  private static final String S3_SCHEME = "s3://";

  private final String bucket;
  private final String key;

  private ObjectLocation(final String bucket, final String key) {
    this.bucket = bucket;
    this.key = key;
  }

  /**
   * Parse an "s3://bucket/key" url or a bare key.
   *
   * @param url the url
   * @return the object location
   * @throws DecodeException if the url is malformed or names another scheme
   */
  public static ObjectLocation parse(final String url) {
    if (url.startsWith(S3_SCHEME)) {
      final String rest = url.substring(S3_SCHEME.length());
      final int slash = rest.indexOf('/');
      if (slash <= 0 || slash == rest.length() - 1) {
        throw new DecodeException("Malformed object url: " + url);
      }
      return new ObjectLocation(rest.substring(0, slash), rest.substring(slash + 1));
    }
    if (url.contains("://")) {
      throw new DecodeException("Unsupported object url scheme: " + url);
    }
    return new ObjectLocation(null, url.startsWith("/") ? url.substring(1) : url);
  }

  public Optional<String> bucket() {
    return Optional.ofNullable(bucket);
  }

  public String key() {
    return key;
  }

  @Override
  public String toString() {
    return bucket == null ? key : S3_SCHEME + bucket + "/" + key;
  }
}
