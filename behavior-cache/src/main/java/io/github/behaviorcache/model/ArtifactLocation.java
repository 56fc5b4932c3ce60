package io.github.behaviorcache.model;

/**
 * Where a row's artifact lives, decided once when the row is decoded: either the row names a
 * file itself, or it names rows of another record type that do.
 */
public interface ArtifactLocation {

  /**
   * Direct location.
   *
   * @param fileId the file id
   * @return the artifact location
   */
  static ArtifactLocation direct(final FileIdentifier fileId) {
    return ImmutableDirectArtifact.of(fileId);
  }

  /**
   * Indirect location.
   *
   * @param references the references, in table order
   * @return the artifact location
   */
  static ArtifactLocation indirect(final Iterable<RecordRef> references) {
    return ImmutableIndirectArtifact.builder().addAllReferences(references).build();
  }
}
