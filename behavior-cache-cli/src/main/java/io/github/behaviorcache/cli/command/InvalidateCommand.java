package io.github.behaviorcache.cli.command;

import io.github.behaviorcache.dagger.BehaviorCacheComponent;
import io.github.behaviorcache.model.FileIdentifier;
import java.io.PrintWriter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Drops one cached data file.
 */
@Command(
    name = "invalidate",
    description = "Remove one data file from the local cache so the next fetch downloads it again")
public class InvalidateCommand extends CacheCommand {

  @Option(
      names = {"--file-id", "-f"},
      description = "File identifier as listed in the manifest",
      required = true)
  private String fileId;

  @Override
  protected void execute(final BehaviorCacheComponent component, final PrintWriter out) {
    final boolean removed = component.behaviorProjectCacheFactory().open()
        .invalidate(FileIdentifier.of(fileId));
    out.println(removed ? "removed " + fileId : "not cached: " + fileId);
    out.flush();
  }
}
