package io.github.behaviorcache.store;

import io.github.behaviorcache.exception.DownloadException;
import io.github.behaviorcache.exception.NotFoundException;
import io.github.behaviorcache.model.FileIdentifier;
import io.github.behaviorcache.model.Manifest;
import io.github.behaviorcache.model.ManifestFile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * Object store client backed by an S3 bucket.
 */
public class S3ObjectStoreClient implements ObjectStoreClient {

  private static final Logger log = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3;
  private final String bucket;

  /**
   * Instantiates a new S3 object store client.
   *
   * @param s3     the s3 client
   * @param bucket the bucket manifest keys and relative urls live in
   */
  public S3ObjectStoreClient(final S3Client s3, final String bucket) {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("S3 bucket not configured");
    }
    this.s3 = s3;
    this.bucket = bucket;
  }

  @Override
  public List<String> listVersions(final String project) {
    final String prefix = ManifestKeys.prefix(project);
    final List<String> versions = new ArrayList<>();
    String token = null;
    try {
      do {
        final ListObjectsV2Request.Builder request =
            ListObjectsV2Request.builder().bucket(bucket).prefix(prefix);
        if (token != null) {
          request.continuationToken(token);
        }
        final ListObjectsV2Response response = s3.listObjectsV2(request.build());
        for (S3Object object : response.contents()) {
          ManifestKeys.version(object.key()).ifPresent(versions::add);
        }
        token = Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
      } while (token != null);
    } catch (S3Exception e) {
      throw map("LIST", bucket, prefix, e);
    } catch (SdkClientException e) {
      throw new DownloadException(msg("LIST", bucket, prefix, e.getMessage()), e);
    }
    log.debug("Found {} manifests under s3://{}/{}", versions.size(), bucket, prefix);
    return versions;
  }

  @Override
  public byte[] fetchManifest(final String project, final String version) {
    return getBytes(bucket, ManifestKeys.key(project, version), null);
  }

  @Override
  public byte[] fetchMetadataTable(final Manifest manifest, final String tableName) {
    final ManifestFile file = manifest.metadataFiles().get(tableName);
    if (file == null) {
      throw new NotFoundException(String.format("Manifest %s %s has no metadata table %s",
          manifest.projectName(), manifest.manifestVersion(), tableName));
    }
    final ObjectLocation location = ObjectLocation.parse(file.url());
    return getBytes(location.bucket().orElse(bucket), location.key(), file.versionId().orElse(null));
  }

  @Override
  public void download(final Manifest manifest, final FileIdentifier fileId,
                       final Path destination) {
    final ManifestFile file = manifest.dataFile(fileId)
        .orElseThrow(() -> new NotFoundException(String.format(
            "Manifest %s %s has no data file %s",
            manifest.projectName(), manifest.manifestVersion(), fileId.value())));
    final ObjectLocation location = ObjectLocation.parse(file.url());
    final String b = location.bucket().orElse(bucket);
    try {
      s3.getObject(request(b, location.key(), file.versionId().orElse(null)), destination);
      log.debug("Downloaded s3://{}/{} to {}", b, location.key(), destination);
    } catch (S3Exception e) {
      throw map("GET", b, location.key(), e);
    } catch (SdkClientException e) {
      throw new DownloadException(msg("GET", b, location.key(), e.getMessage()), e);
    }
  }

  private byte[] getBytes(final String b, final String key, final String versionId) {
    try {
      return s3.getObject(request(b, key, versionId), ResponseTransformer.toBytes()).asByteArray();
    } catch (S3Exception e) {
      throw map("GET", b, key, e);
    } catch (SdkClientException e) {
      throw new DownloadException(msg("GET", b, key, e.getMessage()), e);
    }
  }

  private static GetObjectRequest request(final String b, final String key,
                                          final String versionId) {
    final GetObjectRequest.Builder builder = GetObjectRequest.builder().bucket(b).key(key);
    if (versionId != null && !versionId.isBlank()) {
      builder.versionId(versionId);
    }
    return builder.build();
  }

  private static RuntimeException map(final String op, final String b, final String key,
                                      final S3Exception e) {
    if (e instanceof NoSuchKeyException || e.statusCode() == 404) {
      return new NotFoundException(msg(op, b, key, "not found"), e);
    }
    final boolean retryable = e.statusCode() >= 500 || e.statusCode() == 429;
    return new DownloadException(msg(op, b, key, e.getMessage()), e, retryable);
  }

  private static String msg(final String op, final String b, final String key,
                            final String detail) {
    return String.format("S3 %s s3://%s/%s failed: %s", op, b, key, detail);
  }
}
