package io.github.behaviorcache.manifest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.behaviorcache.ReleaseFixture;
import io.github.behaviorcache.cache.CacheLayout;
import io.github.behaviorcache.cache.Retrier;
import io.github.behaviorcache.exception.DecodeException;
import io.github.behaviorcache.exception.DownloadException;
import io.github.behaviorcache.exception.NotFoundException;
import io.github.behaviorcache.model.Manifest;
import io.github.behaviorcache.model.ManifestDiff;
import io.github.behaviorcache.store.LocalDirectoryObjectStoreClient;
import io.github.behaviorcache.store.ManifestKeys;
import io.github.behaviorcache.store.ObjectStoreClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestCatalogTest {

  private static final String PROJECT = "visual-behavior-ophys";

  @TempDir Path tempDir;

  private ReleaseFixture release;
  private CacheLayout cacheLayout;
  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    release = new ReleaseFixture(tempDir.resolve("bucket"), PROJECT);
    cacheLayout = new CacheLayout(tempDir.resolve("cache"));
    objectMapper = new ObjectMapper().findAndRegisterModules();
  }

  private ManifestCatalog catalog(final ObjectStoreClient client) {
    return new ManifestCatalog(client, cacheLayout, new Retrier(2, Duration.ZERO), objectMapper);
  }

  private ManifestCatalog catalog() {
    return catalog(new LocalDirectoryObjectStoreClient(release.root()));
  }

  @Test
  void listVersions_semanticOrder() throws Exception {
    // Given
    release.publish("1.9.0");
    release.publish("1.10.0");
    release.publish("1.2.0");
    Files.writeString(release.root().resolve(ManifestKeys.prefix(PROJECT)).resolve("README.txt"), "x");

    // When / Then
    assertThat(catalog().listVersions(PROJECT)).containsExactly("1.2.0", "1.9.0", "1.10.0");
    assertThat(catalog().latestVersion(PROJECT)).isEqualTo("1.10.0");
  }

  @Test
  void listVersions_unknownProject() {
    assertThatThrownBy(() -> catalog().listVersions("no-such-project"))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("no-such-project");
  }

  @Test
  void load_parsesAndPersists() throws Exception {
    // Given
    release.table("ophys_experiment_table", "ophys_experiment_id,file_id\n1,11\n")
        .dataFile("11", "bytes");
    release.publish("1.0.0");

    // When
    final Manifest manifest = catalog().load(PROJECT, "1.0.0");

    // Then
    assertThat(manifest.manifestVersion()).isEqualTo("1.0.0");
    assertThat(manifest.metadataTableNames()).containsExactly("ophys_experiment_table");
    assertThat(manifest.dataFiles()).containsKey("11");
    assertThat(manifest.hashAlgorithm()).isEqualTo("SHA-256");
    assertThat(cacheLayout.manifestFile(PROJECT, "1.0.0")).exists();
  }

  @Test
  void load_servesPersistedManifestWithoutTheStore() throws Exception {
    // Given
    release.publish("1.0.0");
    catalog().load(PROJECT, "1.0.0");
    Files.delete(release.root().resolve(ManifestKeys.key(PROJECT, "1.0.0")));

    // When
    final Manifest manifest = catalog().load(PROJECT, "1.0.0");

    // Then
    assertThat(manifest.manifestVersion()).isEqualTo("1.0.0");
  }

  @Test
  void load_unknownVersion() {
    release.publish("1.0.0");

    assertThatThrownBy(() -> catalog().load(PROJECT, "2.0.0"))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void load_malformedManifest() throws Exception {
    // Given
    final Path key = release.root().resolve(ManifestKeys.key(PROJECT, "1.0.0"));
    Files.createDirectories(key.getParent());
    Files.writeString(key, "{\"project_name\": \"visual-behavior-ophys\", ");

    // When / Then
    assertThatThrownBy(() -> catalog().load(PROJECT, "1.0.0"))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("manifest 1.0.0");
    assertThat(cacheLayout.manifestFile(PROJECT, "1.0.0")).doesNotExist();
  }

  @Test
  void latestVersion_fallsBackToDownloadedManifestsWhenOffline() {
    // Given
    release.publish("1.9.0");
    release.publish("1.10.0");
    catalog().load(PROJECT, "1.9.0");
    catalog().load(PROJECT, "1.10.0");
    final ObjectStoreClient offline = mock(ObjectStoreClient.class);
    when(offline.listVersions(PROJECT)).thenThrow(new DownloadException("no route to host", null));

    // When / Then
    assertThat(catalog(offline).latestVersion(PROJECT)).isEqualTo("1.10.0");
    assertThat(catalog(offline).downloadedVersions(PROJECT)).containsExactly("1.9.0", "1.10.0");
  }

  @Test
  void latestVersion_offlineWithNothingDownloadedFails() {
    final ObjectStoreClient offline = mock(ObjectStoreClient.class);
    when(offline.listVersions(PROJECT)).thenThrow(new DownloadException("no route to host", null));

    assertThatThrownBy(() -> catalog(offline).latestVersion(PROJECT))
        .isInstanceOf(DownloadException.class);
  }

  @Test
  void markUsed_isRemembered() {
    final ManifestCatalog catalog = catalog();
    assertThat(catalog.lastUsedVersion(PROJECT)).isEmpty();

    catalog.markUsed(PROJECT, "1.9.0");
    catalog.markUsed(PROJECT, "1.10.0");

    assertThat(catalog().lastUsedVersion(PROJECT)).contains("1.10.0");
  }

  @Test
  void compare_listsChanges() {
    // Given
    release.table("ophys_experiment_table", "ophys_experiment_id,file_id\n1,11\n")
        .table("ophys_session_table", "ophys_session_id,file_id\n5,\n")
        .dataFile("11", "eleven")
        .dataFile("12", "twelve");
    release.publish("1.0.0");
    release.table("ophys_experiment_table", "ophys_experiment_id,file_id\n1,11\n2,13\n")
        .table("behavior_session_table", "behavior_session_id,file_id\n7,14\n")
        .dataFile("12", "twelve, fixed")
        .dataFile("13", "thirteen")
        .pipelineVersion("2.9.0");
    release.publish("1.1.0");

    // When
    final ManifestDiff diff = catalog().compare(PROJECT, "1.0.0", "1.1.0");

    // Then
    assertThat(diff.addedTables()).containsExactly("behavior_session_table");
    assertThat(diff.removedTables()).isEmpty();
    assertThat(diff.changedTables()).containsExactly("ophys_experiment_table");
    assertThat(diff.addedDataFiles()).containsExactly("13");
    assertThat(diff.changedDataFiles()).containsExactly("12");
    assertThat(diff.removedDataFiles()).isEmpty();
    assertThat(diff.pipelineChanged()).isTrue();
    assertThat(diff.isEmpty()).isFalse();
    assertThat(catalog().compare(PROJECT, "1.0.0", "1.0.0").isEmpty()).isTrue();
  }
}
