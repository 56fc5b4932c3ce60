package io.github.behaviorcache;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens a downloaded artifact as a domain object. The cache knows nothing of the artifact format;
 * callers plug in their own reader.
 *
 * @param <T> the domain object type
 */
@FunctionalInterface
public interface ArtifactLoader<T> {

  /**
   * Load the artifact at a verified local path.
   *
   * @param path the path
   * @return the domain object
   * @throws IOException if the artifact cannot be read
   */
  T load(Path path) throws IOException;
}
