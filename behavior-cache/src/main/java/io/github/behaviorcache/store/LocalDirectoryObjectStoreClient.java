package io.github.behaviorcache.store;

import io.github.behaviorcache.exception.DecodeException;
import io.github.behaviorcache.exception.DownloadException;
import io.github.behaviorcache.exception.NotFoundException;
import io.github.behaviorcache.model.FileIdentifier;
import io.github.behaviorcache.model.Manifest;
import io.github.behaviorcache.model.ManifestFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Object store client over a directory laid out like the bucket. Bucket names in s3:// urls are
 * ignored; keys resolve against the root.
 */
public class LocalDirectoryObjectStoreClient implements ObjectStoreClient {

  private static final Logger log = LoggerFactory.getLogger(LocalDirectoryObjectStoreClient.class);

  private final Path root;

  /**
   * Instantiates a new Local directory object store client.
   *
   * @param root the mirror root
   */
  public LocalDirectoryObjectStoreClient(final Path root) {
    this.root = root;
  }

  @Override
  public List<String> listVersions(final String project) {
    final Path dir = resolve(ManifestKeys.prefix(project));
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files.map(path -> ManifestKeys.version(path.getFileName().toString()))
          .flatMap(Optional::stream)
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new DownloadException("Cannot list " + dir, e);
    }
  }

  @Override
  public byte[] fetchManifest(final String project, final String version) {
    return read(resolve(ManifestKeys.key(project, version)));
  }

  @Override
  public byte[] fetchMetadataTable(final Manifest manifest, final String tableName) {
    final ManifestFile file = manifest.metadataFiles().get(tableName);
    if (file == null) {
      throw new NotFoundException(String.format("Manifest %s %s has no metadata table %s",
          manifest.projectName(), manifest.manifestVersion(), tableName));
    }
    return read(resolve(ObjectLocation.parse(file.url()).key()));
  }

  @Override
  public void download(final Manifest manifest, final FileIdentifier fileId,
                       final Path destination) {
    final ManifestFile file = manifest.dataFile(fileId)
        .orElseThrow(() -> new NotFoundException(String.format(
            "Manifest %s %s has no data file %s",
            manifest.projectName(), manifest.manifestVersion(), fileId.value())));
    final Path source = resolve(ObjectLocation.parse(file.url()).key());
    try {
      Files.copy(source, destination);
      log.debug("Copied {} to {}", source, destination);
    } catch (NoSuchFileException e) {
      throw new NotFoundException("No such object: " + source, e);
    } catch (IOException e) {
      throw new DownloadException("Cannot copy " + source + " to " + destination, e);
    }
  }

  private Path resolve(final String key) {
    final Path path = root.resolve(key).normalize();
    if (!path.startsWith(root.normalize())) {
      throw new DecodeException("Key escapes the store root: " + key);
    }
    return path;
  }

  private static byte[] read(final Path path) {
    try {
      return Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      throw new NotFoundException("No such object: " + path, e);
    } catch (IOException e) {
      throw new DownloadException("Cannot read " + path, e);
    }
  }
}
