package io.github.behaviorcache.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.behaviorcache.cache.FileDigests;
import io.github.behaviorcache.store.ManifestKeys;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class BehaviorCacheCliTest {

  private static final String PROJECT = "visual-behavior-ophys";

  @TempDir Path tempDir;

  private Path bucket;
  private StringWriter out;
  private CommandLine commandLine;

  @BeforeEach
  void setUp() throws IOException {
    bucket = tempDir.resolve("bucket");
    out = new StringWriter();
    commandLine = new CommandLine(new BehaviorCacheCli());
    commandLine.setOut(new PrintWriter(out));

    final Map<String, String> tables = new LinkedHashMap<>();
    tables.put("behavior_session_table", """
        behavior_session_id,ophys_session_id,ophys_experiment_id,file_id
        870987812,,,870987812
        951520319,951410079,"[951980471]",
        """);
    tables.put("ophys_session_table", """
        ophys_session_id,ophys_experiment_id,file_id
        951410079,"[951980471]",
        """);
    tables.put("ophys_experiment_table", """
        ophys_experiment_id,ophys_session_id,file_id
        951980471,951410079,951980471
        """);
    publish("1.0.0", tables, Map.of("870987812", "behavior only", "951980471", "experiment"));
    publish("1.1.0", tables, Map.of("870987812", "behavior only, reprocessed",
        "951980471", "experiment"));
  }

  private int run(final String... args) {
    final List<String> all = new ArrayList<>(List.of(args));
    all.addAll(List.of(
        "--cache-dir", tempDir.resolve("cache").toString(),
        "--local-store", bucket.toString()));
    return commandLine.execute(all.toArray(new String[0]));
  }

  @Test
  void versionsMarksLatest() {
    // When
    final int exitCode = run("versions");

    // Then
    assertThat(exitCode).isZero();
    assertThat(out.toString().lines()).containsExactly("1.0.0", "1.1.0 (latest)");
  }

  @Test
  void fetchPrintsPathOfDownloadedArtifact() throws IOException {
    // When
    final int exitCode = run("fetch", "--type", "behavior_session", "--id", "951520319");

    // Then
    assertThat(exitCode).isZero();
    final Path path = Path.of(out.toString().trim());
    assertThat(Files.readString(path)).isEqualTo("experiment");
  }

  @Test
  void fetchHonoursPinnedVersionAndVersionsShowsIt() throws IOException {
    // When
    final int fetched = run("fetch", "-t", "behavior_session", "-i", "870987812",
        "--manifest-version", "1.0.0");
    final Path path = Path.of(out.toString().trim());
    out.getBuffer().setLength(0);
    final int listed = run("versions");

    // Then
    assertThat(fetched).isZero();
    assertThat(listed).isZero();
    assertThat(Files.readString(path)).isEqualTo("behavior only");
    assertThat(out.toString().lines()).containsExactly("1.0.0 (last used)", "1.1.0 (latest)");
  }

  @Test
  void diffListsChangedDataFile() {
    // When
    final int exitCode = run("diff", "--from", "1.0.0", "--to", "1.1.0");

    // Then
    assertThat(exitCode).isZero();
    assertThat(out.toString().lines()).containsExactly("1.0.0 -> 1.1.0", "~ file 870987812");
  }

  @Test
  void invalidateReportsWhetherTheFileWasCached() {
    // Given
    assertThat(run("fetch", "--type", "ophys_experiment", "--id", "951980471")).isZero();
    out.getBuffer().setLength(0);

    // When
    final int first = run("invalidate", "--file-id", "951980471");
    final int second = run("invalidate", "--file-id", "951980471");

    // Then
    assertThat(first).isZero();
    assertThat(second).isZero();
    assertThat(out.toString().lines())
        .containsExactly("removed 951980471", "not cached: 951980471");
  }

  @Test
  void unknownRecordExitsWithOne() {
    final int exitCode = run("fetch", "--type", "ophys_experiment", "--id", "1");

    assertThat(exitCode).isEqualTo(1);
    assertThat(out.toString()).isEmpty();
  }

  @Test
  void malformedManifestVersionExitsWithOne() {
    final int exitCode = run("fetch", "-t", "behavior_session", "-i", "870987812",
        "--manifest-version", "latest");

    assertThat(exitCode).isEqualTo(1);
    assertThat(out.toString()).isEmpty();
  }

  @Test
  void incompatibleClientExitsWithOneUnlessSkipped() {
    // Given
    final Map<String, String> tables = Map.of(
        "behavior_session_table", "behavior_session_id,file_id\n1,1\n",
        "ophys_session_table", "ophys_session_id,ophys_experiment_id,file_id\n",
        "ophys_experiment_table", "ophys_experiment_id,file_id\n");
    final Path other = tempDir.resolve("other");
    final String cache = tempDir.resolve("other-cache").toString();
    publish(other, "1.0.0", "4.0.0", tables, Map.of("1", "future"));

    // When
    final int refused = commandLine.execute("fetch", "-t", "behavior_session", "-i", "1",
        "--cache-dir", cache, "--local-store", other.toString());
    final int skipped = commandLine.execute("fetch", "-t", "behavior_session", "-i", "1",
        "--cache-dir", cache, "--local-store", other.toString(),
        "--skip-version-check");

    // Then
    assertThat(refused).isEqualTo(1);
    assertThat(skipped).isZero();
  }

  @Test
  void missingRequiredOptionIsAUsageError() {
    assertThat(run("fetch", "--type", "behavior_session")).isEqualTo(2);
  }

  private void publish(final String version, final Map<String, String> tables,
                       final Map<String, String> dataFiles) {
    publish(bucket, version, "2.10.0", tables, dataFiles);
  }

  private void publish(final Path root, final String version, final String pipelineVersion,
                       final Map<String, String> tables, final Map<String, String> dataFiles) {
    final List<String> metadata = new ArrayList<>();
    tables.forEach((name, csv) ->
        metadata.add(descriptor(root, name, PROJECT + "/metadata/" + name + ".csv", csv)));
    final List<String> data = new ArrayList<>();
    dataFiles.forEach((fileId, content) ->
        data.add(descriptor(root, fileId, PROJECT + "/data/" + fileId + "/" + fileId + "_"
            + Integer.toHexString(content.hashCode()) + ".nwb", content)));
    final String manifest = """
        {
          "project_name": "%s",
          "manifest_version": "%s",
          "metadata_file_id_column_name": "file_id",
          "data_pipeline": [{"name": "AllenSDK", "version": "%s", "comment": "cli test"}],
          "metadata_files": {%s},
          "data_files": {%s}
        }
        """.formatted(PROJECT, version, pipelineVersion, String.join(",", metadata),
        String.join(",", data));
    write(root, ManifestKeys.key(PROJECT, version), manifest);
  }

  private static String descriptor(final Path root, final String name, final String key,
                                   final String content) {
    write(root, key, content);
    final String hash = FileDigests.hex(content.getBytes(StandardCharsets.UTF_8), "SHA-256");
    return "\"%s\": {\"url\": \"%s\", \"version_id\": \"v1\", \"file_hash\": \"%s\"}"
        .formatted(name, key, hash);
  }

  private static void write(final Path root, final String key, final String content) {
    try {
      final Path path = root.resolve(key);
      Files.createDirectories(path.getParent());
      Files.writeString(path, content);
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
  }
}
