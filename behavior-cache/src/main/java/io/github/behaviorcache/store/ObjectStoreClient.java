package io.github.behaviorcache.store;

import io.github.behaviorcache.model.FileIdentifier;
import io.github.behaviorcache.model.Manifest;
import java.nio.file.Path;
import java.util.List;

/**
 * Read access to the immutable store holding the releases. Implementations throw
 * {@link io.github.behaviorcache.exception.NotFoundException} for objects that do not exist and
 * {@link io.github.behaviorcache.exception.DownloadException} for transport failures.
 */
public interface ObjectStoreClient {

  /**
   * Manifest versions published for a project, in no particular order.
   *
   * @param project the project
   * @return the versions
   */
  List<String> listVersions(String project);

  /**
   * Raw manifest JSON.
   *
   * @param project the project
   * @param version the version
   * @return the bytes
   */
  byte[] fetchManifest(String project, String version);

  /**
   * Raw CSV bytes of a metadata table named by the manifest.
   *
   * @param manifest  the manifest
   * @param tableName the table name
   * @return the bytes
   */
  byte[] fetchMetadataTable(Manifest manifest, String tableName);

  /**
   * Write a data file to {@code destination}, which must not exist yet.
   *
   * @param manifest    the manifest naming the file
   * @param fileId      the file id
   * @param destination the destination
   */
  void download(Manifest manifest, FileIdentifier fileId, Path destination);
}
