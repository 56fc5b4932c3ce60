package io.github.behaviorcache.exception;

import java.nio.file.Path;

/**
 * A cached or freshly downloaded file does not match its expected size or digest.
 */
public class CorruptCacheException extends BehaviorCacheException {

  private final String fileId;
  private final Path path;

  /**
   * Instantiates a new Corrupt cache exception.
   *
   * @param fileId the file id
   * @param path   the offending path
   * @param detail what failed to match
   */
  public CorruptCacheException(final String fileId, final Path path, final String detail) {
    super(String.format("File %s at %s failed verification: %s", fileId, path, detail));
    this.fileId = fileId;
    this.path = path;
  }

  public String fileId() {
    return fileId;
  }

  public Path path() {
    return path;
  }
}
