package io.github.behaviorcache.cli.command;

import io.github.behaviorcache.dagger.BehaviorCacheComponent;
import io.github.behaviorcache.manifest.ManifestCatalog;
import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

/**
 * Lists the published manifest versions.
 */
@Command(
    name = "versions",
    description = "List manifest versions, marking the latest and the last used")
public class VersionsCommand extends CacheCommand {

  private static final Logger log = LoggerFactory.getLogger(VersionsCommand.class);

  @Override
  protected void execute(final BehaviorCacheComponent component, final PrintWriter out) {
    final ManifestCatalog catalog = component.manifestCatalog();
    final String project = options.project();
    log.info("Listing manifests of {}", project);
    final List<String> versions = catalog.listVersions(project);
    final String latest = versions.get(versions.size() - 1);
    final Optional<String> lastUsed = catalog.lastUsedVersion(project);
    for (String version : versions) {
      final StringBuilder line = new StringBuilder(version);
      if (version.equals(latest)) {
        line.append(" (latest)");
      }
      if (lastUsed.isPresent() && lastUsed.get().equals(version)) {
        line.append(" (last used)");
      }
      out.println(line);
    }
    out.flush();
  }
}
