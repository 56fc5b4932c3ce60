package io.github.behaviorcache.cache;

import io.github.behaviorcache.model.FileIdentifier;
import java.nio.file.Path;

/**
 * Paths inside the persistent cache directory.
 *
 * <pre>
 * &lt;root&gt;/&lt;project&gt;/manifests/&lt;version&gt;.json
 * &lt;root&gt;/&lt;project&gt;/_manifest_last_used.txt
 * &lt;root&gt;/&lt;project&gt;/metadata/&lt;version&gt;/&lt;table&gt;.csv
 * &lt;root&gt;/&lt;project&gt;/data/&lt;file id&gt;/&lt;file name&gt;
 * &lt;root&gt;/&lt;project&gt;/data/&lt;file id&gt;/entry.json
 * &lt;root&gt;/&lt;project&gt;/data/&lt;file id&gt;.lock
 * </pre>
 */
public class CacheLayout {

  public static final String ENTRY_FILE = "entry.json";

  private final Path root;

  /**
   * Instantiates a new Cache layout.
   *
   * @param root the cache directory
   */
  public CacheLayout(final Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  public Path projectDirectory(final String project) {
    return root.resolve(safe(project));
  }

  public Path manifestsDirectory(final String project) {
    return projectDirectory(project).resolve("manifests");
  }

  public Path manifestFile(final String project, final String version) {
    return manifestsDirectory(project).resolve(safe(version) + ".json");
  }

  public Path lastUsedFile(final String project) {
    return projectDirectory(project).resolve("_manifest_last_used.txt");
  }

  public Path metadataFile(final String project, final String version, final String table) {
    return projectDirectory(project).resolve("metadata").resolve(safe(version))
        .resolve(safe(table) + ".csv");
  }

  public Path dataDirectory(final String project) {
    return projectDirectory(project).resolve("data");
  }

  public Path entryDirectory(final String project, final FileIdentifier fileId) {
    return dataDirectory(project).resolve(safe(fileId.value()));
  }

  public Path entryFile(final String project, final FileIdentifier fileId) {
    return entryDirectory(project, fileId).resolve(ENTRY_FILE);
  }

  public Path lockFile(final String project, final FileIdentifier fileId) {
    return dataDirectory(project).resolve(safe(fileId.value()) + ".lock");
  }

  /**
   * Replace characters that are not safe in a single path segment.
   *
   * @param segment the segment
   * @return the safe segment
   */
  static String safe(final String segment) {
    final String cleaned = segment.replaceAll("[^A-Za-z0-9._-]", "_");
    return cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..") ? "_" + cleaned : cleaned;
  }
}
