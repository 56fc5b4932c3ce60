package io.github.behaviorcache.dagger;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.behaviorcache.model.ImmutableConfiguration;
import io.github.behaviorcache.store.LocalDirectoryObjectStoreClient;
import io.github.behaviorcache.store.S3ObjectStoreClient;
import io.github.behaviorcache.version.SemanticVersion;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BehaviorCacheComponentTest {

  @TempDir Path tempDir;

  @Test
  void testCreateFactory() {
    final BehaviorCacheComponent component = BehaviorCacheComponent.instance(
        ImmutableConfiguration.builder().cacheDirectory(tempDir).build());

    assertThat(component.behaviorProjectCacheFactory()).isNotNull();
    assertThat(component.objectStoreClient()).isInstanceOf(S3ObjectStoreClient.class);
    assertThat(component.cacheLayout().root()).isEqualTo(tempDir.toAbsolutePath().normalize());
  }

  @Test
  void testLocalMirrorSelectsLocalStore() {
    final BehaviorCacheComponent component = BehaviorCacheComponent.instance(
        ImmutableConfiguration.builder()
            .cacheDirectory(tempDir.resolve("cache"))
            .localStoreRoot(tempDir.resolve("mirror"))
            .build());

    assertThat(component.objectStoreClient()).isInstanceOf(LocalDirectoryObjectStoreClient.class);
  }

  @Test
  void testClientVersionDefaultsToLibraryVersion() {
    final BehaviorCacheComponent component = BehaviorCacheComponent.instance(
        ImmutableConfiguration.builder().cacheDirectory(tempDir).build());

    assertThat(component.versionCompatibilityChecker().clientVersion())
        .isEqualTo(SemanticVersion.parse("2.10.0"));
  }

  @Test
  void testClientVersionOverride() {
    final BehaviorCacheComponent component = BehaviorCacheComponent.instance(
        ImmutableConfiguration.builder().cacheDirectory(tempDir).clientVersion("2.9.1").build());

    assertThat(component.versionCompatibilityChecker().clientVersion())
        .isEqualTo(SemanticVersion.parse("2.9.1"));
  }

  @Test
  void testExplicitStoreWins() {
    final LocalDirectoryObjectStoreClient store = new LocalDirectoryObjectStoreClient(tempDir);

    final BehaviorCacheComponent component = BehaviorCacheComponent.instance(
        ImmutableConfiguration.builder().cacheDirectory(tempDir).build(), store);

    assertThat(component.objectStoreClient()).isSameAs(store);
    assertThat(component.metadataTableStore()).isSameAs(component.metadataTableStore());
  }
}
