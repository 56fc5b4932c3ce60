package io.github.behaviorcache.table;

import io.github.behaviorcache.cache.AtomicFiles;
import io.github.behaviorcache.cache.CacheLayout;
import io.github.behaviorcache.cache.FileDigests;
import io.github.behaviorcache.cache.Retrier;
import io.github.behaviorcache.converter.LiteralValueDecoder;
import io.github.behaviorcache.converter.ScalarCellParser;
import io.github.behaviorcache.exception.BehaviorCacheException;
import io.github.behaviorcache.exception.CorruptCacheException;
import io.github.behaviorcache.exception.DecodeException;
import io.github.behaviorcache.exception.NotFoundException;
import io.github.behaviorcache.model.ArtifactLocation;
import io.github.behaviorcache.model.FileIdentifier;
import io.github.behaviorcache.model.ImmutableRecordRef;
import io.github.behaviorcache.model.Manifest;
import io.github.behaviorcache.model.ManifestFile;
import io.github.behaviorcache.model.ProjectLayout;
import io.github.behaviorcache.model.RecordRef;
import io.github.behaviorcache.model.RecordType;
import io.github.behaviorcache.store.ObjectStoreClient;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the metadata tables a manifest declares.
 *
 * <p>Each row goes through the base normalization (structured column decoding), then the record
 * type's own normalizer, then column suppression. Any cell failing to decode aborts the whole
 * load. The row's artifact location is decided here, once: a non-null file id column makes it
 * direct, otherwise the record type's reference column lists the rows that carry the file.
 *
 * <p>Loaded tables are kept for the lifetime of this store, keyed by project, manifest version and
 * table, so repeated loads return the same instance. Raw CSV bytes are cached on disk and reused
 * while they match the manifest's hash.
 */
public class MetadataTableStore {

  private static final Logger log = LoggerFactory.getLogger(MetadataTableStore.class);

  private final ObjectStoreClient objectStoreClient;
  private final CacheLayout cacheLayout;
  private final Retrier retrier;
  private final ProjectLayout projectLayout;
  private final ScalarCellParser scalarCellParser;
  private final RowNormalizer baseNormalizer;
  private final ConcurrentMap<String, MetadataTable> loaded = new ConcurrentHashMap<>();

  /**
   * Instantiates a new Metadata table store.
   *
   * @param objectStoreClient   the object store client
   * @param cacheLayout         the cache layout
   * @param retrier             the retrier
   * @param projectLayout       the project layout
   * @param literalValueDecoder the literal value decoder
   * @param scalarCellParser    the scalar cell parser
   */
  public MetadataTableStore(final ObjectStoreClient objectStoreClient,
                            final CacheLayout cacheLayout,
                            final Retrier retrier,
                            final ProjectLayout projectLayout,
                            final LiteralValueDecoder literalValueDecoder,
                            final ScalarCellParser scalarCellParser) {
    this.objectStoreClient = objectStoreClient;
    this.cacheLayout = cacheLayout;
    this.retrier = retrier;
    this.projectLayout = projectLayout;
    this.scalarCellParser = scalarCellParser;
    this.baseNormalizer =
        new StructuredColumnDecoder(projectLayout.structuredColumns(), literalValueDecoder);
  }

  /**
   * Load a table.
   *
   * @param manifest  the manifest
   * @param tableName the table name
   * @return the table
   */
  public MetadataTable load(final Manifest manifest, final String tableName) {
    final String key = manifest.projectName() + '/' + manifest.manifestVersion() + '/' + tableName;
    return loaded.computeIfAbsent(key, k -> read(manifest, tableName));
  }

  /**
   * Load the table of a record type.
   *
   * @param manifest   the manifest
   * @param recordType the record type
   * @return the table
   */
  public MetadataTable load(final Manifest manifest, final RecordType recordType) {
    return load(manifest, recordType.tableName());
  }

  private MetadataTable read(final Manifest manifest, final String tableName) {
    final ManifestFile descriptor = manifest.metadataFiles().get(tableName);
    if (descriptor == null) {
      throw new NotFoundException(String.format("Manifest %s %s has no metadata table %s",
          manifest.projectName(), manifest.manifestVersion(), tableName));
    }
    final RecordType recordType = projectLayout.recordTypes().stream()
        .filter(type -> type.tableName().equals(tableName))
        .findFirst()
        .orElseThrow(() -> new NotFoundException(
            "No record type declared for metadata table " + tableName));
    final byte[] bytes = tableBytes(manifest, tableName, descriptor);
    final MetadataTable table = parse(manifest, recordType, bytes);
    log.info("Loaded {} ({} rows) from {} manifest {}",
        tableName, table.size(), manifest.projectName(), manifest.manifestVersion());
    return table;
  }

  private MetadataTable parse(final Manifest manifest, final RecordType recordType,
                              final byte[] bytes) {
    final String tableName = recordType.tableName();
    final String fileIdColumn = manifest.fileIdColumn(tableName);
    final RowNormalizer normalizer = baseNormalizer
        .andThen(recordType.normalizer())
        .andThen(RowNormalizer.dropColumns(recordType.suppressedColumns()));
    final Set<String> columns = new LinkedHashSet<>();
    final List<MetadataRow> rows = new ArrayList<>();

    try (Reader reader = new InputStreamReader(new ByteArrayInputStream(bytes), StandardCharsets.UTF_8);
         CSVParser csvParser = new CSVParser(reader,
             CSVFormat.DEFAULT.builder()
                 .setHeader()
                 .setSkipHeaderRecord(true)
                 .setAllowMissingColumnNames(true)
                 .setTrim(true)
                 .build())) {
      final List<String> header = csvParser.getHeaderNames();
      columns.addAll(header);
      if (!header.contains(recordType.primaryKeyColumn())) {
        throw new DecodeException(context(manifest, tableName)
            + ": missing primary key column " + recordType.primaryKeyColumn());
      }
      long rowNumber = 0;
      for (final CSVRecord record : csvParser) {
        rowNumber++;
        Map<String, Object> row = new LinkedHashMap<>();
        for (final String column : header) {
          row.put(column, record.isSet(column) ? scalarCellParser.parse(record.get(column)) : null);
        }
        try {
          row = normalizer.normalize(row);
        } catch (DecodeException e) {
          throw new DecodeException(
              context(manifest, tableName) + ", row " + rowNumber + ": " + e.getMessage(), e);
        }
        columns.addAll(row.keySet());
        final long id = primaryKey(manifest, recordType, rowNumber, row);
        rows.add(new MetadataRow(id, row,
            location(manifest, recordType, fileIdColumn, rowNumber, row)));
      }
    } catch (IOException | IllegalStateException | IllegalArgumentException e) {
      throw new DecodeException(context(manifest, tableName) + ": unreadable CSV: "
          + e.getMessage(), e);
    }
    columns.removeIf(column -> recordType.suppressedColumns().contains(column));
    return new MetadataTable(tableName, recordType.name(), manifest.manifestVersion(),
        new ArrayList<>(columns), rows);
  }

  private static long primaryKey(final Manifest manifest, final RecordType recordType,
                                 final long rowNumber, final Map<String, Object> row) {
    final Object value = row.get(recordType.primaryKeyColumn());
    final Optional<Long> id = integral(value);
    if (id.isEmpty()) {
      throw new DecodeException(String.format("%s, row %d: primary key %s must be an integer, got %s",
          context(manifest, recordType.tableName()), rowNumber, recordType.primaryKeyColumn(), value));
    }
    return id.get();
  }

  private static ArtifactLocation location(final Manifest manifest, final RecordType recordType,
                                           final String fileIdColumn, final long rowNumber,
                                           final Map<String, Object> row) {
    final Object fileId = row.get(fileIdColumn);
    if (fileId != null && !isNaN(fileId)) {
      return ArtifactLocation.direct(FileIdentifier.of(fileId));
    }
    final List<RecordRef> references = new ArrayList<>();
    if (recordType.referenceColumn().isPresent()) {
      final String target = recordType.referencedRecordType().orElseThrow();
      final Object cell = row.get(recordType.referenceColumn().get());
      final List<?> ids = cell instanceof List ? (List<?>) cell
          : cell == null ? List.of() : List.of(cell);
      for (Object element : ids) {
        final long refId = integral(element).orElseThrow(() -> new DecodeException(String.format(
            "%s, row %d: reference %s must hold integers, got %s",
            context(manifest, recordType.tableName()), rowNumber,
            recordType.referenceColumn().get(), cell)));
        references.add(ImmutableRecordRef.of(target, refId));
      }
    }
    return ArtifactLocation.indirect(references);
  }

  private static Optional<Long> integral(final Object value) {
    if (value instanceof Long || value instanceof Integer) {
      return Optional.of(((Number) value).longValue());
    }
    if (value instanceof Double) {
      final double d = (Double) value;
      if (!Double.isNaN(d) && !Double.isInfinite(d) && d == Math.rint(d)) {
        return Optional.of((long) d);
      }
    }
    return Optional.empty();
  }

  private static boolean isNaN(final Object value) {
    return value instanceof Double && ((Double) value).isNaN();
  }

  private byte[] tableBytes(final Manifest manifest, final String tableName,
                            final ManifestFile descriptor) {
    final Path cached =
        cacheLayout.metadataFile(manifest.projectName(), manifest.manifestVersion(), tableName);
    final String algorithm = manifest.hashAlgorithm();
    try {
      if (Files.isRegularFile(cached)) {
        final byte[] bytes = Files.readAllBytes(cached);
        if (descriptor.fileHash().isEmpty()
            || FileDigests.matches(descriptor.fileHash().get(), FileDigests.hex(bytes, algorithm))) {
          log.debug("Using cached metadata table {}", cached);
          return bytes;
        }
        log.warn("Cached metadata table {} does not match the manifest hash, fetching again", cached);
      }
      for (int attempt = 1; ; attempt++) {
        final byte[] bytes = retrier.call("Fetch of metadata table " + tableName,
            () -> objectStoreClient.fetchMetadataTable(manifest, tableName));
        final String digest = FileDigests.hex(bytes, algorithm);
        if (descriptor.fileHash().isEmpty()
            || FileDigests.matches(descriptor.fileHash().get(), digest)) {
          AtomicFiles.write(cached, bytes);
          return bytes;
        }
        if (attempt == 2) {
          throw new CorruptCacheException(tableName, cached,
              "expected " + algorithm + " " + descriptor.fileHash().get() + ", got " + digest);
        }
        log.warn("Metadata table {} failed verification, fetching again", tableName);
      }
    } catch (IOException e) {
      throw new BehaviorCacheException("Cannot cache metadata table " + tableName + " at " + cached, e);
    }
  }

  private static String context(final Manifest manifest, final String tableName) {
    return String.format("%s manifest %s, table %s",
        manifest.projectName(), manifest.manifestVersion(), tableName);
  }
}
