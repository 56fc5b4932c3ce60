package io.github.behaviorcache.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.immutables.value.Value;

/**
 * An immutable release descriptor: which metadata tables exist, which data files they link to,
 * and which pipeline versions wrote them.
 */
@Value.Immutable
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonSerialize(as = ImmutableManifest.class)
@JsonDeserialize(as = ImmutableManifest.class)
public interface Manifest {

  /**
   * The default digest algorithm for file_hash values.
   */
  String DEFAULT_HASH_ALGORITHM = "SHA-256";

  /**
   * Project the release belongs to.
   */
  @JsonProperty("project_name")
  String projectName();

  /**
   * Semantic version of this release.
   */
  @JsonProperty("manifest_version")
  String manifestVersion();

  /**
   * Column, in every metadata table, holding the data file identifier.
   */
  @JsonProperty("metadata_file_id_column_name")
  String fileIdColumn();

  /**
   * Per-table overrides of {@link #fileIdColumn()}.
   */
  @JsonProperty("file_id_columns")
  Map<String, String> fileIdColumnOverrides();

  /**
   * Digest algorithm used for every file_hash in this manifest.
   */
  @Value.Default
  @JsonProperty("hash_algorithm")
  default String hashAlgorithm() {
    return DEFAULT_HASH_ALGORITHM;
  }

  /**
   * Producing pipeline versions.
   */
  @JsonProperty("data_pipeline")
  List<PipelineVersion> dataPipeline();

  /**
   * Metadata tables by table name.
   */
  @JsonProperty("metadata_files")
  Map<String, ManifestFile> metadataFiles();

  /**
   * Data files by file identifier.
   */
  @JsonProperty("data_files")
  Map<String, ManifestFile> dataFiles();

  /**
   * Sorted metadata table names.
   *
   * @return the table names
   */
  default Set<String> metadataTableNames() {
    return new TreeSet<>(metadataFiles().keySet());
  }

  /**
   * The file identifier column for a table.
   *
   * @param tableName the table name
   * @return the column name
   */
  default String fileIdColumn(final String tableName) {
    return fileIdColumnOverrides().getOrDefault(tableName, fileIdColumn());
  }

  /**
   * Data file descriptor.
   *
   * @param fileId the file id
   * @return the descriptor if the manifest lists it
   */
  default Optional<ManifestFile> dataFile(final FileIdentifier fileId) {
    return Optional.ofNullable(dataFiles().get(fileId.value()));
  }
}
