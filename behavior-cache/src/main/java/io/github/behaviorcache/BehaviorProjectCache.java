package io.github.behaviorcache;

import io.github.behaviorcache.cache.LocalArtifactCache;
import io.github.behaviorcache.model.FileIdentifier;
import io.github.behaviorcache.model.Manifest;
import io.github.behaviorcache.model.ProjectLayouts;
import io.github.behaviorcache.resolver.RecordResolver;
import io.github.behaviorcache.table.MetadataTable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * A session over one manifest of a project. Only built by {@link BehaviorProjectCacheFactory},
 * after the manifest passed the compatibility check and its tables loaded, so every method here
 * works on trusted tables.
 */
public class BehaviorProjectCache {

  private final Manifest manifest;
  private final RecordResolver recordResolver;
  private final LocalArtifactCache artifactCache;

  /**
   * Instantiates a new Behavior project cache.
   *
   * @param manifest       the active manifest
   * @param recordResolver the record resolver over its tables
   * @param artifactCache  the artifact cache for its data files
   */
  BehaviorProjectCache(final Manifest manifest,
                       final RecordResolver recordResolver,
                       final LocalArtifactCache artifactCache) {
    this.manifest = manifest;
    this.recordResolver = recordResolver;
    this.artifactCache = artifactCache;
  }

  public Manifest manifest() {
    return manifest;
  }

  /**
   * The loaded table of a record type.
   *
   * @param recordType the record type
   * @return the table
   */
  public MetadataTable table(final String recordType) {
    return recordResolver.table(recordType);
  }

  public MetadataTable behaviorSessionTable() {
    return table(ProjectLayouts.BEHAVIOR_SESSION);
  }

  public MetadataTable ophysSessionTable() {
    return table(ProjectLayouts.OPHYS_SESSION);
  }

  public MetadataTable ophysExperimentTable() {
    return table(ProjectLayouts.OPHYS_EXPERIMENT);
  }

  /**
   * File identifier of a record's artifact.
   *
   * @param recordType the record type
   * @param recordId   the record id
   * @return the file identifier
   */
  public FileIdentifier resolve(final String recordType, final long recordId) {
    return recordResolver.resolve(recordType, recordId);
  }

  /**
   * Local path of a record's artifact, downloading it on first use.
   *
   * @param recordType the record type
   * @param recordId   the record id
   * @return the path
   */
  public Path getArtifactPath(final String recordType, final long recordId) {
    return recordResolver.getArtifactPath(recordType, recordId);
  }

  public Path getBehaviorSessionPath(final long behaviorSessionId) {
    return getArtifactPath(ProjectLayouts.BEHAVIOR_SESSION, behaviorSessionId);
  }

  public Path getOphysExperimentPath(final long ophysExperimentId) {
    return getArtifactPath(ProjectLayouts.OPHYS_EXPERIMENT, ophysExperimentId);
  }

  /**
   * Resolve, download and open a record's artifact.
   *
   * @param recordType the record type
   * @param recordId   the record id
   * @param loader     the artifact reader
   * @param <T>        the domain object type
   * @return the domain object
   * @throws IOException if the loader fails
   */
  public <T> T getArtifact(final String recordType, final long recordId,
                           final ArtifactLoader<T> loader) throws IOException {
    return loader.load(getArtifactPath(recordType, recordId));
  }

  /**
   * Drop a cached data file.
   *
   * @param fileId the file id
   * @return true if an entry was removed
   */
  public boolean invalidate(final FileIdentifier fileId) {
    return artifactCache.invalidate(fileId);
  }

  @Override
  public String toString() {
    return "BehaviorProjectCache{" + manifest.projectName() + " " + manifest.manifestVersion() + '}';
  }
}
