package io.github.behaviorcache.model;

import org.immutables.value.Value;

/**
 * The row carries its own file identifier.
 */
@Value.Immutable
public interface DirectArtifact extends ArtifactLocation {

  @Value.Parameter
  FileIdentifier fileId();
}
