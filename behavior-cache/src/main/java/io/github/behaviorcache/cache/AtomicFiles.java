package io.github.behaviorcache.cache;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes that never leave a partial file at the final path: content goes to a uniquely named
 * sibling first and is then renamed into place.
 */
public final class AtomicFiles {

  private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

  private AtomicFiles() {
  }

  /**
   * A fresh, not yet existing, sibling of {@code target}.
   *
   * @param target the final path
   * @return the temporary path
   */
  public static Path tempSibling(final Path target) {
    return target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".part");
  }

  /**
   * Write bytes to {@code target} atomically.
   *
   * @param target the target
   * @param bytes  the bytes
   * @throws IOException on failure; the target is left untouched
   */
  public static void write(final Path target, final byte[] bytes) throws IOException {
    Files.createDirectories(target.getParent());
    final Path temp = tempSibling(target);
    try {
      Files.write(temp, bytes);
      install(temp, target);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  /**
   * Rename a completed temporary file onto its final path, replacing what is there.
   *
   * @param temp   the completed file
   * @param target the final path
   * @throws IOException on failure
   */
  public static void install(final Path temp, final Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /**
   * Delete, ignoring absence.
   *
   * @param path the path
   */
  static void deleteQuietly(final Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not delete {}: {}", path, e.getMessage());
    }
  }
}
