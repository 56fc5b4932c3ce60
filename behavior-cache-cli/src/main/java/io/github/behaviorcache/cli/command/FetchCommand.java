package io.github.behaviorcache.cli.command;

import io.github.behaviorcache.BehaviorProjectCache;
import io.github.behaviorcache.dagger.BehaviorCacheComponent;
import java.io.PrintWriter;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Downloads the artifact of one record and prints its path.
 */
@Command(
    name = "fetch",
    description = "Resolve a record, download its artifact and print the local path")
public class FetchCommand extends CacheCommand {

  private static final Logger log = LoggerFactory.getLogger(FetchCommand.class);

  @Option(
      names = {"--type", "-t"},
      description = "Record type, e.g. behavior_session, ophys_session, ophys_experiment",
      required = true)
  private String recordType;

  @Option(
      names = {"--id", "-i"},
      description = "Record id",
      required = true)
  private long recordId;

  @Override
  protected void execute(final BehaviorCacheComponent component, final PrintWriter out) {
    final BehaviorProjectCache cache = component.behaviorProjectCacheFactory().open();
    log.info("Fetching {} {} from {}", recordType, recordId, cache);
    final Path path = cache.getArtifactPath(recordType, recordId);
    out.println(path);
    out.flush();
  }
}
