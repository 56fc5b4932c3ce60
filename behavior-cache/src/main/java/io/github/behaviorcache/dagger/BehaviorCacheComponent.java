package io.github.behaviorcache.dagger;

import dagger.Component;
import io.github.behaviorcache.BehaviorProjectCacheFactory;
import io.github.behaviorcache.cache.CacheLayout;
import io.github.behaviorcache.manifest.ManifestCatalog;
import io.github.behaviorcache.model.Configuration;
import io.github.behaviorcache.store.ObjectStoreClient;
import io.github.behaviorcache.table.MetadataTableStore;
import io.github.behaviorcache.version.VersionCompatibilityChecker;
import javax.inject.Singleton;

/**
 * The behavior cache component.
 */
@Singleton
@Component(modules = {BehaviorCacheModule.class, ObjectStoreModule.class,
    ConfigurationModule.class, CommonModule.class})
public interface BehaviorCacheComponent {

  /**
   * Instance behavior cache component.
   *
   * @param configuration the configuration
   * @return the behavior cache component
   */
  static BehaviorCacheComponent instance(final Configuration configuration) {
    return DaggerBehaviorCacheComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  /**
   * Instance with a given object store, for mirrors and tests.
   *
   * @param configuration     the configuration
   * @param objectStoreClient the object store client
   * @return the behavior cache component
   */
  static BehaviorCacheComponent instance(final Configuration configuration,
                                         final ObjectStoreClient objectStoreClient) {
    return DaggerBehaviorCacheComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .objectStoreModule(new ObjectStoreModule(objectStoreClient))
        .build();
  }

  /**
   * Session factory.
   *
   * @return the behavior project cache factory
   */
  BehaviorProjectCacheFactory behaviorProjectCacheFactory();

  /**
   * Manifest catalog.
   *
   * @return the manifest catalog
   */
  ManifestCatalog manifestCatalog();

  /**
   * Compatibility checker.
   *
   * @return the version compatibility checker
   */
  VersionCompatibilityChecker versionCompatibilityChecker();

  /**
   * Metadata table store.
   *
   * @return the metadata table store
   */
  MetadataTableStore metadataTableStore();

  /**
   * Object store client.
   *
   * @return the object store client
   */
  ObjectStoreClient objectStoreClient();

  /**
   * Cache layout.
   *
   * @return the cache layout
   */
  CacheLayout cacheLayout();
}
