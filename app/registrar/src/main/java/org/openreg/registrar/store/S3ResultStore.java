/*
 * どこで: Registrar 成果物保存
 * 何を: S3 互換オブジェクトストレージに成果物を保存する
 * なぜ: 複数ノード構成で成果物を共有し、期限付き URL で直接配布するため
 */
package org.openreg.registrar.store;

import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.openreg.registrar.model.ResultRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "S3Client/S3Presigner は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class S3ResultStore implements ResultStore {

  private static final Logger logger = LoggerFactory.getLogger(S3ResultStore.class);

  // 署名付き URL の有効期限上限 (SigV4 の制約)
  @VisibleForTesting
  static final Duration MAX_URL_TTL = Duration.ofDays(7);

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final String bucket;
  private final String prefix;

  public S3ResultStore(S3Client s3Client, S3Presigner s3Presigner, String bucket, String prefix) {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("result store bucket is required");
    }
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
    this.bucket = bucket;
    this.prefix = prefix == null ? "" : prefix;
  }

  @Override
  public ResultRef put(UUID jobId, InputStream payload, long length, String contentType) {
    final String key = key(ResultStore.objectKey(jobId, contentType));
    try {
      s3Client.putObject(
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentLength(length)
              .contentType(contentType)
              .build(),
          RequestBody.fromInputStream(payload, length));
      logger.debug("result stored jobId={} bucket={} key={}", jobId, bucket, key);
      return new ResultRef(key);
    } catch (SdkException ex) {
      throw new ResultStoreException("failed to store result for job " + jobId, ex);
    }
  }

  @Override
  public StoredResult get(ResultRef ref) {
    try {
      final ResponseBytes<GetObjectResponse> bytes =
          s3Client.getObjectAsBytes(request(ref));
      final String contentType = bytes.response().contentType();
      return new StoredResult(
          bytes.asByteArray(), contentType == null ? "application/octet-stream" : contentType);
    } catch (NoSuchKeyException ex) {
      throw new ResultStoreException("result not found: " + ref.value(), ex);
    } catch (SdkException ex) {
      throw new ResultStoreException("failed to read result: " + ref.value(), ex);
    }
  }

  @Override
  public void delete(ResultRef ref) {
    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(ref.value()).build());
    } catch (SdkException ex) {
      throw new ResultStoreException("failed to delete result: " + ref.value(), ex);
    }
  }

  @Override
  public Optional<URI> downloadUrl(ResultRef ref, Duration ttl) {
    final Duration bounded = ttl == null || ttl.compareTo(MAX_URL_TTL) > 0 ? MAX_URL_TTL : ttl;
    try {
      final PresignedGetObjectRequest presigned =
          s3Presigner.presignGetObject(
              GetObjectPresignRequest.builder()
                  .signatureDuration(bounded)
                  .getObjectRequest(request(ref))
                  .build());
      return Optional.of(presigned.url().toURI());
    } catch (SdkException | URISyntaxException ex) {
      // 成果物は /result から取得できる
      logger.warn("failed to presign result url key={}", ref.value(), ex);
      return Optional.empty();
    }
  }

  private GetObjectRequest request(ResultRef ref) {
    return GetObjectRequest.builder().bucket(bucket).key(ref.value()).build();
  }

  private String key(String objectKey) {
    if (prefix.isEmpty()) {
      return objectKey;
    }
    return prefix.endsWith("/") ? prefix + objectKey : prefix + "/" + objectKey;
  }
}
