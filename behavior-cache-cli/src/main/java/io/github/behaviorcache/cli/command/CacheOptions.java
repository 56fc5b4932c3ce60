package io.github.behaviorcache.cli.command;

import io.github.behaviorcache.model.Configuration;
import io.github.behaviorcache.model.ImmutableConfiguration;
import java.nio.file.Path;
import picocli.CommandLine.Option;

/**
 * Options shared by every command.
 */
public class CacheOptions {

  @Option(
      names = {"--cache-dir", "-c"},
      description = "Local cache directory (default: ${DEFAULT-VALUE})",
      defaultValue = "${sys:user.home}/.behavior-cache")
  private Path cacheDirectory;

  @Option(
      names = {"--project", "-p"},
      description = "Project name (default: ${DEFAULT-VALUE})",
      defaultValue = "visual-behavior-ophys")
  private String project;

  @Option(
      names = {"--bucket"},
      description = "S3 bucket holding the releases (default: ${DEFAULT-VALUE})",
      defaultValue = "visual-behavior-ophys-data")
  private String bucket;

  @Option(
      names = {"--region"},
      description = "S3 bucket region (default: ${DEFAULT-VALUE})",
      defaultValue = "us-west-2")
  private String region;

  @Option(
      names = {"--local-store"},
      description = "Directory mirroring the bucket, used instead of S3")
  private Path localStore;

  @Option(
      names = {"--manifest-version", "-m"},
      description = "Manifest version to open (default: latest)")
  private String manifestVersion;

  @Option(
      names = {"--skip-version-check"},
      description = "Open manifests this client is not known to be compatible with")
  private boolean skipVersionCheck;

  public String project() {
    return project;
  }

  /**
   * Configuration for these options.
   *
   * @return the configuration
   */
  public Configuration configuration() {
    final ImmutableConfiguration.Builder builder = ImmutableConfiguration.builder()
        .cacheDirectory(cacheDirectory)
        .project(project)
        .bucket(bucket)
        .region(region)
        .skipVersionCheck(skipVersionCheck);
    if (localStore != null) {
      builder.localStoreRoot(localStore);
    }
    if (manifestVersion != null) {
      builder.manifestVersion(manifestVersion);
    }
    return builder.build();
  }
}
