package io.github.behaviorcache.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Location and checksum of one object named by a manifest, either a metadata table or a data
 * file.
 */
@Value.Immutable
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(as = ImmutableManifestFile.class)
@JsonDeserialize(as = ImmutableManifestFile.class)
public interface ManifestFile {

  /**
   * Either "s3://bucket/key" or a key relative to the configured bucket.
   */
  String url();

  /**
   * Object version, pinned so a release never drifts.
   */
  @JsonProperty("version_id")
  Optional<String> versionId();

  /**
   * Lowercase hex digest of the object's bytes.
   */
  @JsonProperty("file_hash")
  Optional<String> fileHash();

  /**
   * Last path segment of the url, used as the local file name.
   *
   * @return the file name
   */
  default String fileName() {
    final String url = url();
    final int queryStart = url.indexOf('?');
    final String path = queryStart >= 0 ? url.substring(0, queryStart) : url;
    final int slash = path.lastIndexOf('/');
    return slash >= 0 ? path.substring(slash + 1) : path;
  }
}
