package io.github.behaviorcache.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import io.github.behaviorcache.BehaviorProjectCacheFactory;
import io.github.behaviorcache.cache.CacheLayout;
import io.github.behaviorcache.cache.Retrier;
import io.github.behaviorcache.converter.LiteralValueDecoder;
import io.github.behaviorcache.converter.ScalarCellParser;
import io.github.behaviorcache.exception.BehaviorCacheException;
import io.github.behaviorcache.manifest.ManifestCatalog;
import io.github.behaviorcache.model.CompatibilityTable;
import io.github.behaviorcache.model.Configuration;
import io.github.behaviorcache.model.ProjectLayout;
import io.github.behaviorcache.store.ObjectStoreClient;
import io.github.behaviorcache.table.MetadataTableStore;
import io.github.behaviorcache.version.SemanticVersion;
import io.github.behaviorcache.version.VersionCompatibilityChecker;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Properties;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * The cache components.
 */
@Module
public class BehaviorCacheModule {

  /**
   * The bundled compatibility table.
   */
  public static final String COMPATIBILITY_JSON = "compatibility.json";

  /**
   * Build information of this library.
   */
  public static final String PROPERTIES = "behavior-cache.properties";

  /**
   * Instantiates a new Behavior cache module.
   */
  public BehaviorCacheModule() {
    // Default constructor
  }

  /**
   * Cache layout.
   *
   * @param configuration the configuration
   * @return the cache layout
   */
  @Provides
  @Singleton
  public CacheLayout cacheLayout(final Configuration configuration) {
    return new CacheLayout(configuration.cacheDirectory());
  }

  /**
   * Retrier.
   *
   * @param configuration the configuration
   * @return the retrier
   */
  @Provides
  @Singleton
  public Retrier retrier(final Configuration configuration) {
    return new Retrier(configuration.maxDownloadAttempts(), configuration.retryBackoff());
  }

  /**
   * Compatibility table, configured or bundled.
   *
   * @param configuration the configuration
   * @param objectMapper  the object mapper
   * @return the compatibility table
   */
  @Provides
  @Singleton
  public CompatibilityTable compatibilityTable(final Configuration configuration,
                                               final ObjectMapper objectMapper) {
    if (configuration.compatibility().isPresent()) {
      return configuration.compatibility().get();
    }
    try (InputStream in = resource(COMPATIBILITY_JSON)) {
      return objectMapper.readValue(in, CompatibilityTable.class);
    } catch (IOException e) {
      throw new BehaviorCacheException("Cannot read bundled " + COMPATIBILITY_JSON, e);
    }
  }

  /**
   * Version of the running client, configured or this library's own.
   *
   * @param configuration the configuration
   * @return the client version
   */
  @Provides
  @Singleton
  @Named("clientVersion")
  public SemanticVersion clientVersion(final Configuration configuration) {
    if (configuration.clientVersion().isPresent()) {
      return parseClientVersion(configuration.clientVersion().get());
    }
    final Properties properties = new Properties();
    try (InputStream in = resource(PROPERTIES)) {
      properties.load(in);
    } catch (IOException e) {
      throw new BehaviorCacheException("Cannot read bundled " + PROPERTIES, e);
    }
    return parseClientVersion(properties.getProperty("client.version"));
  }

  private static SemanticVersion parseClientVersion(final String version) {
    try {
      return SemanticVersion.parse(version);
    } catch (IllegalArgumentException e) {
      throw new BehaviorCacheException("Invalid client version: " + e.getMessage(), e);
    }
  }

  /**
   * Version compatibility checker.
   *
   * @param configuration      the configuration
   * @param compatibilityTable the compatibility table
   * @param clientVersion      the client version
   * @return the version compatibility checker
   */
  @Provides
  @Singleton
  public VersionCompatibilityChecker versionCompatibilityChecker(
      final Configuration configuration,
      final CompatibilityTable compatibilityTable,
      @Named("clientVersion") final SemanticVersion clientVersion) {
    return new VersionCompatibilityChecker(compatibilityTable, clientVersion,
        configuration.skipVersionCheck());
  }

  /**
   * Literal value decoder.
   *
   * @return the literal value decoder
   */
  @Provides
  @Singleton
  public LiteralValueDecoder literalValueDecoder() {
    return new LiteralValueDecoder();
  }

  /**
   * Scalar cell parser.
   *
   * @return the scalar cell parser
   */
  @Provides
  @Singleton
  public ScalarCellParser scalarCellParser() {
    return new ScalarCellParser();
  }

  /**
   * Metadata table store.
   *
   * @param objectStoreClient   the object store client
   * @param cacheLayout         the cache layout
   * @param retrier             the retrier
   * @param projectLayout       the project layout
   * @param literalValueDecoder the literal value decoder
   * @param scalarCellParser    the scalar cell parser
   * @return the metadata table store
   */
  @Provides
  @Singleton
  public MetadataTableStore metadataTableStore(final ObjectStoreClient objectStoreClient,
                                               final CacheLayout cacheLayout,
                                               final Retrier retrier,
                                               final ProjectLayout projectLayout,
                                               final LiteralValueDecoder literalValueDecoder,
                                               final ScalarCellParser scalarCellParser) {
    return new MetadataTableStore(objectStoreClient, cacheLayout, retrier, projectLayout,
        literalValueDecoder, scalarCellParser);
  }

  /**
   * Manifest catalog.
   *
   * @param objectStoreClient the object store client
   * @param cacheLayout       the cache layout
   * @param retrier           the retrier
   * @param objectMapper      the object mapper
   * @return the manifest catalog
   */
  @Provides
  @Singleton
  public ManifestCatalog manifestCatalog(final ObjectStoreClient objectStoreClient,
                                         final CacheLayout cacheLayout,
                                         final Retrier retrier,
                                         final ObjectMapper objectMapper) {
    return new ManifestCatalog(objectStoreClient, cacheLayout, retrier, objectMapper);
  }

  /**
   * Behavior project cache factory.
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
   * @return the behavior project cache factory
   */
  @Provides
  @Singleton
  public BehaviorProjectCacheFactory behaviorProjectCacheFactory(
      final Configuration configuration,
      final ManifestCatalog manifestCatalog,
      final VersionCompatibilityChecker compatibilityChecker,
      final MetadataTableStore metadataTableStore,
      final ObjectStoreClient objectStoreClient,
      final CacheLayout cacheLayout,
      final Retrier retrier,
      final ObjectMapper objectMapper,
      final Clock clock) {
    return new BehaviorProjectCacheFactory(configuration, manifestCatalog, compatibilityChecker,
        metadataTableStore, objectStoreClient, cacheLayout, retrier, objectMapper, clock);
  }

  private static InputStream resource(final String name) throws IOException {
    final InputStream in = BehaviorCacheModule.class.getClassLoader().getResourceAsStream(name);
    if (in == null) {
      throw new IOException("Resource " + name + " not on the classpath");
    }
    return in;
  }
}
