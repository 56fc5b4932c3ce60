package io.github.behaviorcache.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.behaviorcache.exception.DownloadException;
import io.github.behaviorcache.exception.NotFoundException;
import io.github.behaviorcache.model.ImmutableFileIdentifier;
import io.github.behaviorcache.model.ImmutableManifest;
import io.github.behaviorcache.model.ImmutableManifestFile;
import io.github.behaviorcache.model.Manifest;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

@ExtendWith(MockitoExtension.class)
class S3ObjectStoreClientTest {

  private static final String BUCKET = "visual-behavior-ophys-data";
  private static final String PROJECT = "visual-behavior-ophys";

  @Mock private S3Client s3;

  @Captor private ArgumentCaptor<GetObjectRequest> getCaptor;

  @Captor private ArgumentCaptor<ListObjectsV2Request> listCaptor;

  private S3ObjectStoreClient client;

  private final Manifest manifest = ImmutableManifest.builder()
      .projectName(PROJECT)
      .manifestVersion("1.0.0")
      .fileIdColumn("file_id")
      .putMetadataFiles("ophys_experiment_table", ImmutableManifestFile.builder()
          .url("s3://other-bucket/project_metadata/ophys_experiment_table.csv")
          .versionId("abc")
          .build())
      .putDataFiles("1042", ImmutableManifestFile.builder()
          .url("behavior_sessions/behavior_session_1042.nwb")
          .build())
      .build();

  @BeforeEach
  void setUp() {
    client = new S3ObjectStoreClient(s3, BUCKET);
  }

  @Test
  void listVersions_followsContinuationTokens() {
    // Given
    when(s3.listObjectsV2(any(ListObjectsV2Request.class)))
        .thenReturn(ListObjectsV2Response.builder()
            .contents(S3Object.builder().key(ManifestKeys.key(PROJECT, "1.0.0")).build(),
                S3Object.builder().key(PROJECT + "/manifests/notes.txt").build())
            .isTruncated(true)
            .nextContinuationToken("page-2")
            .build())
        .thenReturn(ListObjectsV2Response.builder()
            .contents(S3Object.builder().key(ManifestKeys.key(PROJECT, "1.10.0")).build())
            .isTruncated(false)
            .build());

    // When
    final List<String> versions = client.listVersions(PROJECT);

    // Then
    assertThat(versions).containsExactly("1.0.0", "1.10.0");
    verify(s3, times(2)).listObjectsV2(listCaptor.capture());
    assertThat(listCaptor.getAllValues().get(0).prefix()).isEqualTo(PROJECT + "/manifests/");
    assertThat(listCaptor.getAllValues().get(1).continuationToken()).isEqualTo("page-2");
  }

  @Test
  void fetchMetadataTable_usesUrlBucketAndVersion() {
    // Given
    when(s3.getObject(any(GetObjectRequest.class), any(ResponseTransformer.class)))
        .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(),
            "a,b\n".getBytes(StandardCharsets.UTF_8)));

    // When
    final byte[] bytes = client.fetchMetadataTable(manifest, "ophys_experiment_table");

    // Then
    assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("a,b\n");
    verify(s3).getObject(getCaptor.capture(), any(ResponseTransformer.class));
    assertThat(getCaptor.getValue().bucket()).isEqualTo("other-bucket");
    assertThat(getCaptor.getValue().key()).isEqualTo("project_metadata/ophys_experiment_table.csv");
    assertThat(getCaptor.getValue().versionId()).isEqualTo("abc");
  }

  @Test
  void download_relativeUrlUsesConfiguredBucket() {
    // Given
    final Path destination = Path.of("/tmp/x.part");
    when(s3.getObject(any(GetObjectRequest.class), eq(destination)))
        .thenReturn(GetObjectResponse.builder().build());

    // When
    client.download(manifest, ImmutableFileIdentifier.of("1042"), destination);

    // Then
    verify(s3).getObject(getCaptor.capture(), eq(destination));
    assertThat(getCaptor.getValue().bucket()).isEqualTo(BUCKET);
    assertThat(getCaptor.getValue().key()).isEqualTo("behavior_sessions/behavior_session_1042.nwb");
    assertThat(getCaptor.getValue().versionId()).isNull();
  }

  @Test
  void fetchManifest_missingKeyIsNotFound() {
    when(s3.getObject(any(GetObjectRequest.class), any(ResponseTransformer.class)))
        .thenThrow(NoSuchKeyException.builder().statusCode(404).message("gone").build());

    assertThatThrownBy(() -> client.fetchManifest(PROJECT, "9.9.9"))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining(ManifestKeys.key(PROJECT, "9.9.9"));
  }

  @Test
  void fetchManifest_serverErrorIsRetryable() {
    when(s3.getObject(any(GetObjectRequest.class), any(ResponseTransformer.class)))
        .thenThrow(S3Exception.builder().statusCode(503).message("slow down").build());

    assertThatThrownBy(() -> client.fetchManifest(PROJECT, "1.0.0"))
        .isInstanceOf(DownloadException.class)
        .satisfies(e -> assertThat(((DownloadException) e).isRetryable()).isTrue());
  }

  @Test
  void fetchManifest_accessDeniedIsPermanent() {
    when(s3.getObject(any(GetObjectRequest.class), any(ResponseTransformer.class)))
        .thenThrow(S3Exception.builder().statusCode(403).message("denied").build());

    assertThatThrownBy(() -> client.fetchManifest(PROJECT, "1.0.0"))
        .isInstanceOf(DownloadException.class)
        .satisfies(e -> assertThat(((DownloadException) e).isRetryable()).isFalse());
  }

  @Test
  void download_networkFailureIsRetryable() {
    final Path destination = Path.of("/tmp/x.part");
    when(s3.getObject(any(GetObjectRequest.class), eq(destination)))
        .thenThrow(SdkClientException.create("connection reset"));

    assertThatThrownBy(() -> client.download(manifest, ImmutableFileIdentifier.of("1042"), destination))
        .isInstanceOf(DownloadException.class)
        .satisfies(e -> assertThat(((DownloadException) e).isRetryable()).isTrue());
  }

  @Test
  void download_fileNotInManifest() {
    assertThatThrownBy(() -> client.download(manifest, ImmutableFileIdentifier.of("1"), Path.of("/tmp/y")))
        .isInstanceOf(NotFoundException.class);
  }
}
