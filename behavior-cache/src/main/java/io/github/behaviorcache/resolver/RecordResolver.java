package io.github.behaviorcache.resolver;

import io.github.behaviorcache.cache.LocalArtifactCache;
import io.github.behaviorcache.exception.AmbiguousRecordException;
import io.github.behaviorcache.exception.NotFoundException;
import io.github.behaviorcache.exception.RecordNotFoundException;
import io.github.behaviorcache.exception.UnsupportedIndirectionException;
import io.github.behaviorcache.model.ArtifactLocation;
import io.github.behaviorcache.model.DirectArtifact;
import io.github.behaviorcache.model.FileIdentifier;
import io.github.behaviorcache.model.IndirectArtifact;
import io.github.behaviorcache.model.RecordRef;
import io.github.behaviorcache.table.MetadataRow;
import io.github.behaviorcache.table.MetadataTable;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a record id into the file identifier of its artifact, and from there into a local path.
 *
 * <p>A row naming a file resolves to it. A row grouping records of another type resolves
 * through the <em>first</em> listed reference, always; the other references are not consulted
 * even when the first one cannot be resolved. Only one level of indirection is followed.
 */
public class RecordResolver {

  private static final Logger log = LoggerFactory.getLogger(RecordResolver.class);

  private final Map<String, MetadataTable> tablesByRecordType;
  private final LocalArtifactCache artifactCache;

  /**
   * Instantiates a new Record resolver.
   *
   * @param tablesByRecordType the loaded tables, keyed by record type name
   * @param artifactCache      the artifact cache
   */
  public RecordResolver(final Map<String, MetadataTable> tablesByRecordType,
                        final LocalArtifactCache artifactCache) {
    this.tablesByRecordType = Map.copyOf(tablesByRecordType);
    this.artifactCache = artifactCache;
  }

  /**
   * Resolve a record to its file identifier.
   *
   * @param recordType the record type
   * @param recordId   the record id
   * @return the file identifier
   * @throws RecordNotFoundException  if no row matches, or the row has no artifact
   * @throws AmbiguousRecordException if several rows match
   */
  public FileIdentifier resolve(final String recordType, final long recordId) {
    final MetadataRow row = row(recordType, recordId);
    final ArtifactLocation location = row.location();
    if (location instanceof DirectArtifact) {
      return ((DirectArtifact) location).fileId();
    }
    final List<RecordRef> references = ((IndirectArtifact) location).references();
    if (references.isEmpty()) {
      throw new RecordNotFoundException(recordType, recordId, "has no downloadable artifact");
    }
    final RecordRef first = references.get(0);
    if (references.size() > 1) {
      log.debug("{} {} groups {} {} records, following the first ({})",
          recordType, recordId, references.size(), first.recordType(), first.recordId());
    }
    final MetadataRow referenced = row(first.recordType(), first.recordId());
    if (referenced.location() instanceof DirectArtifact) {
      return ((DirectArtifact) referenced.location()).fileId();
    }
    throw new UnsupportedIndirectionException(String.format(
        "%s %d refers to %s %d, which has no file of its own; only one level of indirection is "
            + "supported", recordType, recordId, first.recordType(), first.recordId()));
  }

  /**
   * Local path of a record's artifact, downloading it if needed.
   *
   * @param recordType the record type
   * @param recordId   the record id
   * @return the verified path
   */
  public Path getArtifactPath(final String recordType, final long recordId) {
    return artifactCache.get(resolve(recordType, recordId));
  }

  /**
   * The table of a record type.
   *
   * @param recordType the record type
   * @return the table
   */
  public MetadataTable table(final String recordType) {
    final MetadataTable table = tablesByRecordType.get(recordType);
    if (table == null) {
      throw new NotFoundException("Unknown record type " + recordType);
    }
    return table;
  }

  private MetadataRow row(final String recordType, final long recordId) {
    final MetadataTable table = table(recordType);
    final List<MetadataRow> matches = table.find(recordId);
    if (matches.isEmpty()) {
      throw new RecordNotFoundException(recordType, recordId,
          "not in " + table.name() + " of manifest " + table.manifestVersion());
    }
    if (matches.size() > 1) {
      throw new AmbiguousRecordException(table.name(), recordId, matches.size());
    }
    return matches.get(0);
  }
}
