package io.github.behaviorcache.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.behaviorcache.exception.BehaviorCacheException;
import io.github.behaviorcache.exception.CorruptCacheException;
import io.github.behaviorcache.exception.NotFoundException;
import io.github.behaviorcache.model.CacheEntry;
import io.github.behaviorcache.model.FileIdentifier;
import io.github.behaviorcache.model.ImmutableCacheEntry;
import io.github.behaviorcache.model.Manifest;
import io.github.behaviorcache.model.ManifestFile;
import io.github.behaviorcache.model.VerificationMode;
import io.github.behaviorcache.store.ObjectStoreClient;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the data files of one manifest to verified local paths.
 *
 * <p>A hit is served from disk with no network access once the file matches its
 * {@link CacheEntry}. A miss downloads to a temporary sibling, checks the manifest's hash and
 * renames the file into place before the entry is written, so the final path never holds a
 * partial download. Population of one entry is serialized through {@link EntryLocks}; distinct
 * entries proceed in parallel.
 *
 * <p>A corrupt entry is dropped and downloaded again. A download that fails verification is
 * retried once; a second failure is surfaced as {@link CorruptCacheException}.
 */
public class LocalArtifactCache {

  private static final Logger log = LoggerFactory.getLogger(LocalArtifactCache.class);
  private static final int VERIFIED_DOWNLOAD_ATTEMPTS = 2;

  private final Manifest manifest;
  private final ObjectStoreClient objectStoreClient;
  private final CacheLayout cacheLayout;
  private final Retrier retrier;
  private final ObjectMapper objectMapper;
  private final VerificationMode verification;
  private final Clock clock;

  /**
   * Instantiates a new Local artifact cache.
   *
   * @param manifest          the active manifest
   * @param objectStoreClient the object store client
   * @param cacheLayout       the cache layout
   * @param retrier           the retrier for transient download failures
   * @param objectMapper      the object mapper for entry files
   * @param verification      how hits are verified
   * @param clock             the clock
   */
  public LocalArtifactCache(final Manifest manifest,
                            final ObjectStoreClient objectStoreClient,
                            final CacheLayout cacheLayout,
                            final Retrier retrier,
                            final ObjectMapper objectMapper,
                            final VerificationMode verification,
                            final Clock clock) {
    this.manifest = manifest;
    this.objectStoreClient = objectStoreClient;
    this.cacheLayout = cacheLayout;
    this.retrier = retrier;
    this.objectMapper = objectMapper;
    this.verification = verification;
    this.clock = clock;
  }

  /**
   * Local path of a data file, downloading it on first use.
   *
   * @param fileId the file id
   * @return a path that exists and passed verification
   */
  public Path get(final FileIdentifier fileId) {
    final ManifestFile descriptor = descriptor(fileId);
    final Optional<Path> hit = verifiedHit(fileId, descriptor);
    if (hit.isPresent()) {
      log.debug("Cache hit for file {} at {}", fileId.value(), hit.get());
      return hit.get();
    }
    try (EntryLocks.Handle lock = EntryLocks.acquire(lockFile(fileId))) {
      // another thread or process may have finished while we waited
      final Optional<Path> installed = verifiedHit(fileId, descriptor);
      if (installed.isPresent()) {
        log.debug("File {} was installed while waiting for its lock", fileId.value());
        return installed.get();
      }
      int attempts = VERIFIED_DOWNLOAD_ATTEMPTS;
      final Optional<CacheEntry> previous = readEntry(fileId);
      if (previous.isPresent() && descriptor.fileHash().isPresent()
          && !FileDigests.matches(descriptor.fileHash().get(), previous.get().digest())) {
        log.info("Cached file {} is from manifest {}, downloading the {} copy", fileId.value(),
            previous.get().manifestVersion(), manifest.manifestVersion());
        removeEntry(fileId);
      } else if (previous.isPresent()) {
        log.warn("Cache entry for file {} failed verification, downloading again", fileId.value());
        removeEntry(fileId);
        attempts = 1;
      } else if (Files.exists(cacheLayout.entryDirectory(project(), fileId))) {
        // left behind by a download that never completed
        log.debug("Clearing unfinished download of file {}", fileId.value());
        removeEntry(fileId);
      }
      return download(fileId, descriptor, attempts);
    }
  }

  /**
   * Whether a verified copy is present, without downloading.
   *
   * @param fileId the file id
   * @return true if a hit
   */
  public boolean isCached(final FileIdentifier fileId) {
    return verifiedHit(fileId, descriptor(fileId)).isPresent();
  }

  /**
   * The entry recorded for a file, verified or not.
   *
   * @param fileId the file id
   * @return the entry
   */
  public Optional<CacheEntry> entry(final FileIdentifier fileId) {
    return readEntry(fileId);
  }

  /**
   * Drop a cache entry and its file. The next {@link #get} downloads again.
   *
   * @param fileId the file id
   * @return true if something was removed
   */
  public boolean invalidate(final FileIdentifier fileId) {
    try (EntryLocks.Handle lock = EntryLocks.acquire(lockFile(fileId))) {
      final boolean existed = Files.exists(cacheLayout.entryDirectory(project(), fileId));
      removeEntry(fileId);
      log.info("Invalidated cache entry for file {}", fileId.value());
      return existed;
    }
  }

  private Path download(final FileIdentifier fileId, final ManifestFile descriptor,
                        final int attempts) {
    final Path target = cacheLayout.entryDirectory(project(), fileId).resolve(fileName(descriptor));
    for (int attempt = 1; attempt <= attempts; attempt++) {
      final Path temp = AtomicFiles.tempSibling(target);
      try {
        Files.createDirectories(target.getParent());
        retrier.run("Download of file " + fileId.value(), () -> {
          AtomicFiles.deleteQuietly(temp);
          objectStoreClient.download(manifest, fileId, temp);
        });
        final String digest = FileDigests.hex(temp, manifest.hashAlgorithm());
        final Optional<String> expected = descriptor.fileHash();
        if (expected.isPresent() && !FileDigests.matches(expected.get(), digest)) {
          final CorruptCacheException corrupt = new CorruptCacheException(fileId.value(), temp,
              "expected " + manifest.hashAlgorithm() + " " + expected.get() + ", got " + digest);
          if (attempt == attempts) {
            log.error("Giving up on file {}: {}", fileId.value(), corrupt.getMessage());
            throw corrupt;
          }
          log.warn("{}; downloading again", corrupt.getMessage());
          continue;
        }
        final long size = Files.size(temp);
        AtomicFiles.install(temp, target);
        writeEntry(fileId, ImmutableCacheEntry.builder()
            .fileId(fileId.value())
            .fileName(target.getFileName().toString())
            .size(size)
            .algorithm(manifest.hashAlgorithm())
            .digest(digest)
            .manifestVersion(manifest.manifestVersion())
            .downloadedAt(clock.instant())
            .build());
        log.info("Downloaded file {} ({} bytes) to {}", fileId.value(), size, target);
        return target;
      } catch (IOException e) {
        throw new BehaviorCacheException("Cannot install file " + fileId.value() + " at " + target, e);
      } finally {
        AtomicFiles.deleteQuietly(temp);
      }
    }
    throw new IllegalStateException("unreachable: no download attempts for " + fileId.value());
  }

  private Optional<Path> verifiedHit(final FileIdentifier fileId, final ManifestFile descriptor) {
    final Optional<CacheEntry> entry = readEntry(fileId);
    if (entry.isEmpty()) {
      return Optional.empty();
    }
    final Path path = cacheLayout.entryDirectory(project(), fileId).resolve(entry.get().fileName());
    try {
      if (!Files.isRegularFile(path) || Files.size(path) != entry.get().size()) {
        return Optional.empty();
      }
      if (descriptor.fileHash().isPresent()
          && !FileDigests.matches(descriptor.fileHash().get(), entry.get().digest())) {
        // cached under another release whose bytes differ
        return Optional.empty();
      }
      if (verification == VerificationMode.DIGEST
          && !FileDigests.matches(entry.get().digest(), FileDigests.hex(path, entry.get().algorithm()))) {
        return Optional.empty();
      }
      return Optional.of(path);
    } catch (IOException e) {
      log.warn("Cannot verify cached file {}: {}", path, e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<CacheEntry> readEntry(final FileIdentifier fileId) {
    final Path entryFile = cacheLayout.entryFile(project(), fileId);
    if (!Files.isRegularFile(entryFile)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(entryFile.toFile(), CacheEntry.class));
    } catch (IOException e) {
      log.warn("Unreadable cache entry {}: {}", entryFile, e.getMessage());
      return Optional.empty();
    }
  }

  private void writeEntry(final FileIdentifier fileId, final CacheEntry entry) throws IOException {
    AtomicFiles.write(cacheLayout.entryFile(project(), fileId), objectMapper.writeValueAsBytes(entry));
  }

  private void removeEntry(final FileIdentifier fileId) {
    final Path dir = cacheLayout.entryDirectory(project(), fileId);
    // entry first, so a concurrent unlocked reader sees a miss rather than a stale entry
    AtomicFiles.deleteQuietly(cacheLayout.entryFile(project(), fileId));
    if (!Files.isDirectory(dir)) {
      return;
    }
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
      for (Path file : files) {
        Files.deleteIfExists(file);
      }
      Files.deleteIfExists(dir);
    } catch (IOException e) {
      throw new BehaviorCacheException("Cannot remove cache entry " + dir, e);
    }
  }

  private ManifestFile descriptor(final FileIdentifier fileId) {
    return manifest.dataFile(fileId)
        .orElseThrow(() -> new NotFoundException(String.format(
            "Manifest %s %s has no data file %s",
            manifest.projectName(), manifest.manifestVersion(), fileId.value())));
  }

  private Path lockFile(final FileIdentifier fileId) {
    return cacheLayout.lockFile(project(), fileId);
  }

  private String project() {
    return manifest.projectName();
  }

  private static String fileName(final ManifestFile descriptor) {
    final String name = CacheLayout.safe(descriptor.fileName());
    return CacheLayout.ENTRY_FILE.equals(name) ? "_" + name : name;
  }
}
