package io.github.behaviorcache.cli.command;

import io.github.behaviorcache.dagger.BehaviorCacheComponent;
import io.github.behaviorcache.model.ManifestDiff;
import java.io.PrintWriter;
import java.util.Set;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Prints what changed between two manifests.
 */
@Command(
    name = "diff",
    description = "Show metadata tables and data files changed between two manifest versions")
public class DiffCommand extends CacheCommand {

  @Option(
      names = {"--from"},
      description = "Older manifest version",
      required = true)
  private String fromVersion;

  @Option(
      names = {"--to"},
      description = "Newer manifest version",
      required = true)
  private String toVersion;

  @Override
  protected void execute(final BehaviorCacheComponent component, final PrintWriter out) {
    final ManifestDiff diff =
        component.manifestCatalog().compare(options.project(), fromVersion, toVersion);
    out.printf("%s -> %s%n", diff.fromVersion(), diff.toVersion());
    if (diff.isEmpty()) {
      out.println("no changes");
      out.flush();
      return;
    }
    print(out, "+ table", diff.addedTables());
    print(out, "- table", diff.removedTables());
    print(out, "~ table", diff.changedTables());
    print(out, "+ file", diff.addedDataFiles());
    print(out, "- file", diff.removedDataFiles());
    print(out, "~ file", diff.changedDataFiles());
    if (diff.pipelineChanged()) {
      out.println("~ data_pipeline");
    }
    out.flush();
  }

  private static void print(final PrintWriter out, final String prefix, final Set<String> names) {
    names.forEach(name -> out.println(prefix + " " + name));
  }
}
