package io.github.behaviorcache.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.behaviorcache.ReleaseFixture;
import io.github.behaviorcache.exception.DecodeException;
import io.github.behaviorcache.exception.NotFoundException;
import io.github.behaviorcache.model.ImmutableFileIdentifier;
import io.github.behaviorcache.model.ImmutableManifest;
import io.github.behaviorcache.model.ImmutableManifestFile;
import io.github.behaviorcache.model.Manifest;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalDirectoryObjectStoreClientTest {

  private static final String PROJECT = "visual-behavior-ophys";

  @TempDir Path tempDir;

  private ReleaseFixture release;
  private LocalDirectoryObjectStoreClient client;

  @BeforeEach
  void setUp() {
    release = new ReleaseFixture(tempDir.resolve("bucket"), PROJECT);
    client = new LocalDirectoryObjectStoreClient(release.root());
  }

  @Test
  void readsWhatTheMirrorHolds() throws Exception {
    // Given
    release.table("ophys_experiment_table", "ophys_experiment_id,file_id\n1,11\n")
        .dataFile("11", "eleven");
    final Manifest manifest = release.publish("1.0.0");
    final Path destination = tempDir.resolve("out.nwb");

    // When
    client.download(manifest, ImmutableFileIdentifier.of("11"), destination);

    // Then
    assertThat(client.listVersions(PROJECT)).containsExactly("1.0.0");
    assertThat(new String(client.fetchManifest(PROJECT, "1.0.0"), StandardCharsets.UTF_8))
        .contains("\"manifest_version\":\"1.0.0\"");
    assertThat(new String(client.fetchMetadataTable(manifest, "ophys_experiment_table"),
        StandardCharsets.UTF_8)).startsWith("ophys_experiment_id");
    assertThat(Files.readString(destination)).isEqualTo("eleven");
  }

  @Test
  void bucketInS3UrlIsIgnored() throws Exception {
    // Given
    final Path object = release.root().resolve("data/f.nwb");
    Files.createDirectories(object.getParent());
    Files.writeString(object, "f");
    final Manifest manifest = ImmutableManifest.builder()
        .projectName(PROJECT)
        .manifestVersion("1.0.0")
        .fileIdColumn("file_id")
        .putDataFiles("1", ImmutableManifestFile.builder().url("s3://any-bucket/data/f.nwb").build())
        .build();

    // When
    client.download(manifest, ImmutableFileIdentifier.of("1"), tempDir.resolve("f"));

    // Then
    assertThat(tempDir.resolve("f")).hasContent("f");
  }

  @Test
  void missingObjectIsNotFound() {
    assertThatThrownBy(() -> client.fetchManifest(PROJECT, "1.0.0"))
        .isInstanceOf(NotFoundException.class);
    assertThat(client.listVersions(PROJECT)).isEmpty();
  }

  @Test
  void keysCannotEscapeTheRoot() {
    final Manifest manifest = ImmutableManifest.builder()
        .projectName(PROJECT)
        .manifestVersion("1.0.0")
        .fileIdColumn("file_id")
        .putDataFiles("1", ImmutableManifestFile.builder().url("../../etc/passwd").build())
        .build();

    assertThatThrownBy(() ->
        client.download(manifest, ImmutableFileIdentifier.of("1"), tempDir.resolve("p")))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("escapes");
  }

  @Test
  void unsupportedUrlSchemeIsADecodeFailure() {
    final Manifest manifest = ImmutableManifest.builder()
        .projectName(PROJECT)
        .manifestVersion("1.0.0")
        .fileIdColumn("file_id")
        .putDataFiles("1", ImmutableManifestFile.builder().url("gs://bucket/key.nwb").build())
        .build();

    assertThatThrownBy(() ->
        client.download(manifest, ImmutableFileIdentifier.of("1"), tempDir.resolve("p")))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("gs://bucket/key.nwb");
  }
}
