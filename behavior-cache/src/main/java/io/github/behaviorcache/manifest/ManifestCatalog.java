package io.github.behaviorcache.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.behaviorcache.cache.AtomicFiles;
import io.github.behaviorcache.cache.CacheLayout;
import io.github.behaviorcache.cache.Retrier;
import io.github.behaviorcache.exception.BehaviorCacheException;
import io.github.behaviorcache.exception.DecodeException;
import io.github.behaviorcache.exception.DownloadException;
import io.github.behaviorcache.exception.NotFoundException;
import io.github.behaviorcache.model.ImmutableManifestDiff;
import io.github.behaviorcache.model.Manifest;
import io.github.behaviorcache.model.ManifestDiff;
import io.github.behaviorcache.model.ManifestFile;
import io.github.behaviorcache.store.ObjectStoreClient;
import io.github.behaviorcache.version.SemanticVersion;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovers the manifest versions of a project and loads them.
 *
 * <p>Versions are ordered semantically, so "1.10.0" is newer than "1.9.0". Every manifest read
 * from the object store is kept under the cache directory and later loads of the same version
 * do not touch the network. The last version a session activated is remembered per project.
 */
public class ManifestCatalog {

  private static final Logger log = LoggerFactory.getLogger(ManifestCatalog.class);

  private final ObjectStoreClient objectStoreClient;
  private final CacheLayout cacheLayout;
  private final Retrier retrier;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Manifest catalog.
   *
   * @param objectStoreClient the object store client
   * @param cacheLayout       the cache layout
   * @param retrier           the retrier
   * @param objectMapper      the object mapper
   */
  public ManifestCatalog(final ObjectStoreClient objectStoreClient,
                         final CacheLayout cacheLayout,
                         final Retrier retrier,
                         final ObjectMapper objectMapper) {
    this.objectStoreClient = objectStoreClient;
    this.cacheLayout = cacheLayout;
    this.retrier = retrier;
    this.objectMapper = objectMapper;
  }

  /**
   * Published versions in ascending semantic order. Names that are not semantic versions are
   * skipped.
   *
   * @param project the project
   * @return the versions
   * @throws NotFoundException if the project has no manifests
   */
  public List<String> listVersions(final String project) {
    final List<String> listed = retrier.call("Listing of " + project + " manifests",
        () -> objectStoreClient.listVersions(project));
    final List<String> valid = new ArrayList<>();
    for (String version : listed) {
      if (SemanticVersion.isValid(version)) {
        valid.add(version);
      } else {
        log.debug("Ignoring manifest version {} of {}", version, project);
      }
    }
    if (valid.isEmpty()) {
      throw new NotFoundException("No manifests published for project " + project);
    }
    return SemanticVersion.sort(valid);
  }

  /**
   * The newest published version. If the store cannot be listed, falls back to the newest
   * version already downloaded.
   *
   * @param project the project
   * @return the version
   */
  public String latestVersion(final String project) {
    try {
      final List<String> versions = listVersions(project);
      return versions.get(versions.size() - 1);
    } catch (DownloadException e) {
      final List<String> local = downloadedVersions(project);
      if (local.isEmpty()) {
        throw e;
      }
      final String newest = local.get(local.size() - 1);
      log.warn("Cannot list manifests of {} ({}); using newest downloaded version {}",
          project, e.getMessage(), newest);
      return newest;
    }
  }

  /**
   * Load a manifest, from the local cache when present.
   *
   * @param project the project
   * @param version the version
   * @return the manifest
   */
  public Manifest load(final String project, final String version) {
    final Path local = cacheLayout.manifestFile(project, version);
    if (Files.isRegularFile(local)) {
      try {
        final Manifest manifest = parse(Files.readAllBytes(local), project, version);
        log.debug("Using downloaded manifest {}", local);
        return manifest;
      } catch (DecodeException e) {
        log.warn("Downloaded manifest {} is unreadable ({}), fetching again", local, e.getMessage());
      } catch (IOException e) {
        throw new BehaviorCacheException("Cannot read manifest " + local, e);
      }
    }
    final byte[] bytes = retrier.call("Fetch of " + project + " manifest " + version,
        () -> objectStoreClient.fetchManifest(project, version));
    final Manifest manifest = parse(bytes, project, version);
    try {
      AtomicFiles.write(local, bytes);
    } catch (IOException e) {
      throw new BehaviorCacheException("Cannot store manifest " + local, e);
    }
    log.info("Loaded {} manifest {}", project, version);
    return manifest;
  }

  /**
   * Versions whose manifests are downloaded, ascending.
   *
   * @param project the project
   * @return the versions
   */
  public List<String> downloadedVersions(final String project) {
    final Path dir = cacheLayout.manifestsDirectory(project);
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    final List<String> versions = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
      for (Path file : files) {
        final String name = file.getFileName().toString();
        final String version = name.substring(0, name.length() - ".json".length());
        if (SemanticVersion.isValid(version)) {
          versions.add(version);
        }
      }
    } catch (IOException e) {
      throw new BehaviorCacheException("Cannot list downloaded manifests in " + dir, e);
    }
    return SemanticVersion.sort(versions);
  }

  /**
   * Remember the version a session activated.
   *
   * @param project the project
   * @param version the version
   */
  public void markUsed(final String project, final String version) {
    final Path file = cacheLayout.lastUsedFile(project);
    try {
      AtomicFiles.write(file, version.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new BehaviorCacheException("Cannot record last used manifest in " + file, e);
    }
  }

  /**
   * The version last activated for the project.
   *
   * @param project the project
   * @return the version, empty if none was ever activated
   */
  public Optional<String> lastUsedVersion(final String project) {
    final Path file = cacheLayout.lastUsedFile(project);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      final String version = Files.readString(file, StandardCharsets.UTF_8).trim();
      return version.isEmpty() ? Optional.empty() : Optional.of(version);
    } catch (IOException e) {
      throw new BehaviorCacheException("Cannot read last used manifest from " + file, e);
    }
  }

  /**
   * Compare two manifests of a project.
   *
   * @param project     the project
   * @param fromVersion the older version
   * @param toVersion   the newer version
   * @return the differences
   */
  public ManifestDiff compare(final String project, final String fromVersion,
                              final String toVersion) {
    final Manifest from = load(project, fromVersion);
    final Manifest to = load(project, toVersion);
    final ImmutableManifestDiff.Builder diff = ImmutableManifestDiff.builder()
        .fromVersion(fromVersion)
        .toVersion(toVersion)
        .pipelineChanged(!from.dataPipeline().equals(to.dataPipeline()));
    compareFiles(from.metadataFiles(), to.metadataFiles(),
        diff::addAddedTables, diff::addRemovedTables, diff::addChangedTables);
    compareFiles(from.dataFiles(), to.dataFiles(),
        diff::addAddedDataFiles, diff::addRemovedDataFiles, diff::addChangedDataFiles);
    return diff.build();
  }

  private static void compareFiles(final Map<String, ManifestFile> from,
                                   final Map<String, ManifestFile> to,
                                   final Consumer<String> added,
                                   final Consumer<String> removed,
                                   final Consumer<String> changed) {
    final Set<String> names = new TreeSet<>(from.keySet());
    names.addAll(to.keySet());
    for (String name : names) {
      final ManifestFile before = from.get(name);
      final ManifestFile after = to.get(name);
      if (before == null) {
        added.accept(name);
      } else if (after == null) {
        removed.accept(name);
      } else if (!Objects.equals(before.url(), after.url())
          || !Objects.equals(before.fileHash(), after.fileHash())) {
        changed.accept(name);
      }
    }
  }

  private Manifest parse(final byte[] bytes, final String project, final String version) {
    final Manifest manifest;
    try {
      manifest = objectMapper.readValue(bytes, Manifest.class);
    } catch (JsonProcessingException e) {
      throw new DecodeException(
          "Malformed " + project + " manifest " + version + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new DecodeException("Unreadable " + project + " manifest " + version, e);
    }
    if (!manifest.projectName().equals(project)) {
      log.warn("Manifest {} of {} names project {}", version, project, manifest.projectName());
    }
    if (!manifest.manifestVersion().equals(version)) {
      log.warn("Manifest {} of {} declares version {}", version, project, manifest.manifestVersion());
    }
    return manifest;
  }
}
