package io.github.behaviorcache.cli;

import io.github.behaviorcache.cli.command.DiffCommand;
import io.github.behaviorcache.cli.command.FetchCommand;
import io.github.behaviorcache.cli.command.InvalidateCommand;
import io.github.behaviorcache.cli.command.VersionsCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main CLI entry point for the behavior cache.
 */
@Command(
    name = "behavior-cache",
    description = "Browse releases and download artifacts of a versioned behavior project",
    mixinStandardHelpOptions = true,
    version = "2.10.0",
    subcommands = {VersionsCommand.class, FetchCommand.class, DiffCommand.class,
        InvalidateCommand.class})
public class BehaviorCacheCli implements Runnable {

  /**
   * Main entry point.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    final int exitCode = new CommandLine(new BehaviorCacheCli()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public void run() {
    // Show help when no subcommand is specified
    CommandLine.usage(this, System.out);
  }
}
