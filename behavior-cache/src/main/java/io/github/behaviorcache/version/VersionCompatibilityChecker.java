package io.github.behaviorcache.version;

import io.github.behaviorcache.exception.VersionIncompatibleException;
import io.github.behaviorcache.model.CompatibilityTable;
import io.github.behaviorcache.model.Manifest;
import io.github.behaviorcache.model.PipelineVersion;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gates use of a manifest on the running client being able to read the data it describes.
 *
 * <p>The manifest's producing-pipeline version is looked up in the {@link CompatibilityTable}; an
 * unregistered version fails the same way an out-of-range client does. Skipping the check is
 * only possible through an explicit constructor flag and is logged every time.
 */
public class VersionCompatibilityChecker {

  private static final Logger log = LoggerFactory.getLogger(VersionCompatibilityChecker.class);

  private final CompatibilityTable compatibilityTable;
  private final SemanticVersion clientVersion;
  private final boolean skip;

  /**
   * Instantiates a new Version compatibility checker.
   *
   * @param compatibilityTable the compatibility table
   * @param clientVersion      the running client version
   * @param skip               explicit opt-out
   */
  public VersionCompatibilityChecker(final CompatibilityTable compatibilityTable,
                                     final SemanticVersion clientVersion,
                                     final boolean skip) {
    this.compatibilityTable = compatibilityTable;
    this.clientVersion = clientVersion;
    this.skip = skip;
  }

  /**
   * Checker that always enforces.
   *
   * @param compatibilityTable the compatibility table
   * @param clientVersion      the client version
   */
  public VersionCompatibilityChecker(final CompatibilityTable compatibilityTable,
                                     final SemanticVersion clientVersion) {
    this(compatibilityTable, clientVersion, false);
  }

  public SemanticVersion clientVersion() {
    return clientVersion;
  }

  /**
   * Check the manifest.
   *
   * @param manifest the manifest
   * @throws VersionIncompatibleException if the client cannot read the release
   */
  public void check(final Manifest manifest) {
    if (skip) {
      log.warn("Version compatibility check SKIPPED for {} manifest {} (client {})",
          manifest.projectName(), manifest.manifestVersion(), clientVersion);
      return;
    }
    final String pipelineName = compatibilityTable.pipelineName();
    final List<PipelineVersion> matches = manifest.dataPipeline().stream()
        .filter(p -> pipelineName.equals(p.name()))
        .collect(Collectors.toList());
    if (matches.size() != 1) {
      throw new VersionIncompatibleException(String.format(
          "Expected exactly 1 data_pipeline entry for %s in %s manifest %s, found %d",
          pipelineName, manifest.projectName(), manifest.manifestVersion(), matches.size()));
    }
    final String pipelineVersion = matches.get(0).version();
    final List<String> bounds = compatibilityTable.bounds(pipelineVersion)
        .orElseThrow(() -> new VersionIncompatibleException(String.format(
            "No version compatibility listed for %s %s (%s manifest %s)",
            pipelineName, pipelineVersion, manifest.projectName(), manifest.manifestVersion())));
    if (bounds.size() != 2) {
      throw new VersionIncompatibleException(String.format(
          "Compatibility entry for %s %s must be [min, max), got %s",
          pipelineName, pipelineVersion, bounds));
    }
    final SemanticVersion min;
    final SemanticVersion max;
    try {
      min = SemanticVersion.parse(bounds.get(0));
      max = SemanticVersion.parse(bounds.get(1));
    } catch (IllegalArgumentException e) {
      throw new VersionIncompatibleException(String.format(
          "Compatibility entry for %s %s is not a version range: %s",
          pipelineName, pipelineVersion, e.getMessage()));
    }
    if (!clientVersion.isWithin(min, max)) {
      throw new VersionIncompatibleException(String.format(
          "Data files of %s manifest %s were written by %s %s and require %s >=%s and <%s; "
              + "this client is %s. Upgrade or downgrade to that range, or use the latest "
              + "manifest with the latest client.",
          manifest.projectName(), manifest.manifestVersion(), pipelineName, pipelineVersion,
          compatibilityTable.consumerName(), min, max, clientVersion));
    }
    log.info("{} manifest {} ({} {}) is compatible with client {}",
        manifest.projectName(), manifest.manifestVersion(), pipelineName, pipelineVersion,
        clientVersion);
  }
}
