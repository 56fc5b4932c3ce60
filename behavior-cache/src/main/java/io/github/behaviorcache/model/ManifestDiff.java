package io.github.behaviorcache.model;

import java.util.Set;
import org.immutables.value.Value;

/**
 * What changed between two manifests of one project.
 */
@Value.Immutable
public interface ManifestDiff {

  String fromVersion();

  String toVersion();

  Set<String> addedTables();

  Set<String> removedTables();

  /**
   * Tables present in both whose hash or url differ.
   */
  Set<String> changedTables();

  Set<String> addedDataFiles();

  Set<String> removedDataFiles();

  Set<String> changedDataFiles();

  /**
   * Whether the pipeline versions differ.
   */
  boolean pipelineChanged();

  /**
   * True when nothing changed.
   *
   * @return the boolean
   */
  default boolean isEmpty() {
    return addedTables().isEmpty() && removedTables().isEmpty() && changedTables().isEmpty()
        && addedDataFiles().isEmpty() && removedDataFiles().isEmpty()
        && changedDataFiles().isEmpty() && !pipelineChanged();
  }
}
