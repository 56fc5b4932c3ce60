package io.github.behaviorcache.cli.command;

import io.github.behaviorcache.dagger.BehaviorCacheComponent;
import io.github.behaviorcache.exception.BehaviorCacheException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Base of the commands: builds the component from the shared options and turns cache failures
 * into exit code 1.
 */
public abstract class CacheCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(CacheCommand.class);

  @Mixin
  protected CacheOptions options;

  @Spec
  private CommandSpec spec;

  @Override
  public Integer call() {
    try {
      execute(BehaviorCacheComponent.instance(options.configuration()), spec.commandLine().getOut());
      return 0;
    } catch (BehaviorCacheException e) {
      log.error("{} failed: {}", spec.name(), e.getMessage());
      log.debug("Failure detail", e);
      return 1;
    }
  }

  /**
   * Run the command.
   *
   * @param component the component
   * @param out       standard output
   */
  protected abstract void execute(BehaviorCacheComponent component, PrintWriter out);
}
