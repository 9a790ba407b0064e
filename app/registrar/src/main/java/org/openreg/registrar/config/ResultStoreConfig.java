/*
 * どこで: Registrar 設定
 * 何を: registrar.result-store.type に応じた ResultStore を提供する
 * なぜ: ジョブ処理側が保存先の違いを意識しないようにするため
 */
package org.openreg.registrar.config;

import java.net.URI;
import java.nio.file.Path;
import org.openreg.registrar.store.FileSystemResultStore;
import org.openreg.registrar.store.ResultStore;
import org.openreg.registrar.store.S3ResultStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@Configuration
public class ResultStoreConfig {

  @Bean
  @ConditionalOnProperty(
      name = "registrar.result-store.type",
      havingValue = "filesystem",
      matchIfMissing = true)
  ResultStore fileSystemResultStore(ResultStoreProperties properties) {
    return new FileSystemResultStore(Path.of(properties.filesystem().root()));
  }

  @Configuration
  @ConditionalOnProperty(name = "registrar.result-store.type", havingValue = "s3")
  static class S3StoreConfig {

    @Bean(destroyMethod = "close")
    S3Client resultStoreS3Client(ResultStoreProperties properties) {
      final ResultStoreProperties.S3 s3 = properties.s3();
      final S3ClientBuilder builder = S3Client.builder().region(Region.of(s3.region()));
      if (s3.endpoint() != null && !s3.endpoint().isBlank()) {
        // MinIO などの S3 互換ストレージはパス形式でアクセスする
        builder
            .endpointOverride(URI.create(s3.endpoint()))
            .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
      }
      return builder.build();
    }

    @Bean(destroyMethod = "close")
    S3Presigner resultStoreS3Presigner(ResultStoreProperties properties) {
      final ResultStoreProperties.S3 s3 = properties.s3();
      final S3Presigner.Builder builder = S3Presigner.builder().region(Region.of(s3.region()));
      if (s3.endpoint() != null && !s3.endpoint().isBlank()) {
        builder
            .endpointOverride(URI.create(s3.endpoint()))
            .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
      }
      return builder.build();
    }

    @Bean
    ResultStore s3ResultStore(
        S3Client resultStoreS3Client,
        S3Presigner resultStoreS3Presigner,
        ResultStoreProperties properties) {
      return new S3ResultStore(
          resultStoreS3Client,
          resultStoreS3Presigner,
          properties.s3().bucket(),
          properties.s3().prefix());
    }
  }
}
