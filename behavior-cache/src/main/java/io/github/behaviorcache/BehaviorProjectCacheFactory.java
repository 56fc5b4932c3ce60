package io.github.behaviorcache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.behaviorcache.cache.CacheLayout;
import io.github.behaviorcache.cache.LocalArtifactCache;
import io.github.behaviorcache.cache.Retrier;
import io.github.behaviorcache.exception.NotFoundException;
import io.github.behaviorcache.manifest.ManifestCatalog;
import io.github.behaviorcache.model.Configuration;
import io.github.behaviorcache.model.Manifest;
import io.github.behaviorcache.model.ProjectLayout;
import io.github.behaviorcache.model.RecordType;
import io.github.behaviorcache.resolver.RecordResolver;
import io.github.behaviorcache.store.ObjectStoreClient;
import io.github.behaviorcache.table.MetadataTable;
import io.github.behaviorcache.table.MetadataTableStore;
import io.github.behaviorcache.version.SemanticVersion;
import io.github.behaviorcache.version.VersionCompatibilityChecker;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link BehaviorProjectCache} sessions. Steps run in a fixed order: pick and load the
 * manifest, check compatibility, check the table set, then load the tables. Nothing is loaded
 * from a manifest that failed the check.
 */
public class BehaviorProjectCacheFactory {

  private static final Logger log = LoggerFactory.getLogger(BehaviorProjectCacheFactory.class);

  private final Configuration configuration;
  private final ManifestCatalog manifestCatalog;
  private final VersionCompatibilityChecker compatibilityChecker;
  private final MetadataTableStore metadataTableStore;
  private final ObjectStoreClient objectStoreClient;
  private final CacheLayout cacheLayout;
  private final Retrier retrier;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Instantiates a new Behavior project cache factory.
   *
   * @param configuration        the configuration
   * @param manifestCatalog      the manifest catalog
   * @param compatibilityChecker the compatibility checker
   * @param metadataTableStore   the metadata table store
   * @param objectStoreClient    the object store client
   * @param cacheLayout          the cache layout
   * @param retrier              the retrier
   * @param objectMapper         the object mapper
   * @param clock                the clock
   */
  public BehaviorProjectCacheFactory(final Configuration configuration,
                                     final ManifestCatalog manifestCatalog,
                                     final VersionCompatibilityChecker compatibilityChecker,
                                     final MetadataTableStore metadataTableStore,
                                     final ObjectStoreClient objectStoreClient,
                                     final CacheLayout cacheLayout,
                                     final Retrier retrier,
                                     final ObjectMapper objectMapper,
                                     final Clock clock) {
    this.configuration = configuration;
    this.manifestCatalog = manifestCatalog;
    this.compatibilityChecker = compatibilityChecker;
    this.metadataTableStore = metadataTableStore;
    this.objectStoreClient = objectStoreClient;
    this.cacheLayout = cacheLayout;
    this.retrier = retrier;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Open the configured version, or the latest one.
   *
   * @return the session
   */
  public BehaviorProjectCache open() {
    final String project = configuration.project();
    final String latest = manifestCatalog.latestVersion(project);
    final String version = configuration.manifestVersion().orElse(latest);
    return open(version, latest);
  }

  /**
   * Open a given version.
   *
   * @param version the manifest version
   * @return the session
   */
  public BehaviorProjectCache open(final String version) {
    return open(version, manifestCatalog.latestVersion(configuration.project()));
  }

  private BehaviorProjectCache open(final String version, final String latest) {
    final String project = configuration.project();
    if (!SemanticVersion.isValid(version)) {
      throw new NotFoundException(String.format(
          "'%s' is not a %s manifest version", version, project));
    }
    final Manifest manifest = manifestCatalog.load(project, version);
    compatibilityChecker.check(manifest);
    checkTables(manifest);
    if (SemanticVersion.parse(version).compareTo(SemanticVersion.parse(latest)) < 0) {
      log.warn("Using {} manifest {}, but {} is the latest available", project, version, latest);
    }
    manifestCatalog.markUsed(project, version);

    final Map<String, MetadataTable> tables = new LinkedHashMap<>();
    for (RecordType recordType : layout().recordTypes()) {
      tables.put(recordType.name(), metadataTableStore.load(manifest, recordType));
    }
    final LocalArtifactCache artifactCache = new LocalArtifactCache(manifest, objectStoreClient,
        cacheLayout, retrier, objectMapper, configuration.verification(), clock);
    log.info("Opened {} manifest {} with {} tables", project, version, tables.size());
    return new BehaviorProjectCache(manifest, new RecordResolver(tables, artifactCache),
        artifactCache);
  }

  public ManifestCatalog manifestCatalog() {
    return manifestCatalog;
  }

  private void checkTables(final Manifest manifest) {
    final Set<String> missing = new TreeSet<>(layout().tableNames());
    missing.removeAll(manifest.metadataFiles().keySet());
    if (!missing.isEmpty()) {
      throw new NotFoundException(String.format("Manifest %s %s lacks metadata tables %s",
          manifest.projectName(), manifest.manifestVersion(), missing));
    }
    final Set<String> unexpected = new TreeSet<>(manifest.metadataFiles().keySet());
    unexpected.removeAll(layout().tableNames());
    if (!unexpected.isEmpty()) {
      log.warn("Manifest {} {} declares tables with no record type, ignoring {}",
          manifest.projectName(), manifest.manifestVersion(), unexpected);
    }
  }

  private ProjectLayout layout() {
    return configuration.layout();
  }
}
