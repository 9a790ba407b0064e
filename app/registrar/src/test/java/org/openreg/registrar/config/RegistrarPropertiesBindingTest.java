/*
 * どこで: Registrar 設定バインドのテスト
 * 何を: ジョブ・成果物保存先・LMS 設定の既定値と Duration バインドを検証する
 * なぜ: 設定不備を起動時に検知し、未指定時に安全な既定値で動くことを保証するため
 */
package org.openreg.registrar.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class RegistrarPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void bindsJobDurationsAndSizes() {
    contextRunner
        .withPropertyValues(
            "registrar.jobs.worker-pool-size=2",
            "registrar.jobs.queue-capacity=10",
            "registrar.jobs.write-batch-size=50",
            "registrar.jobs.timeout=10m",
            "registrar.jobs.finalize-grace=30s",
            "registrar.jobs.dispatch-grace=1m",
            "registrar.jobs.maintenance-interval=15s",
            "registrar.jobs.result-url-ttl=1h")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final JobProperties properties = context.getBean(JobProperties.class);
              assertThat(properties.workerPoolSize()).isEqualTo(2);
              assertThat(properties.queueCapacity()).isEqualTo(10);
              assertThat(properties.writeBatchSize()).isEqualTo(50);
              assertThat(properties.timeout()).isEqualTo(Duration.ofMinutes(10));
              assertThat(properties.finalizeGrace()).isEqualTo(Duration.ofSeconds(30));
              assertThat(properties.dispatchGrace()).isEqualTo(Duration.ofMinutes(1));
              assertThat(properties.maintenanceInterval()).isEqualTo(Duration.ofSeconds(15));
              assertThat(properties.resultUrlTtl()).isEqualTo(Duration.ofHours(1));
            });
  }

  @Test
  void appliesDefaultsWhenNothingIsConfigured() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final JobProperties jobs = context.getBean(JobProperties.class);
          assertThat(jobs.workerPoolSize()).isEqualTo(4);
          assertThat(jobs.writeBatchSize()).isEqualTo(25);
          assertThat(jobs.timeout()).isEqualTo(Duration.ofMinutes(30));
          assertThat(jobs.errorMessageMaxLength()).isEqualTo(1000);

          final ResultStoreProperties store = context.getBean(ResultStoreProperties.class);
          assertThat(store.type()).isEqualTo("filesystem");
          assertThat(store.filesystem().root()).isEqualTo("./var/job-results");
          assertThat(store.s3().region()).isEqualTo("us-east-1");

          final LmsClientProperties lms = context.getBean(LmsClientProperties.class);
          assertThat(lms.programEnrollmentsPath()).contains("{programUuid}");
          assertThat(lms.readTimeout()).isEqualTo(Duration.ofSeconds(60));
        });
  }

  @Test
  void resultStoreTypeIsCaseInsensitive() {
    contextRunner
        .withPropertyValues(
            "registrar.result-store.type=S3",
            "registrar.result-store.s3.bucket=registrar-results",
            "registrar.result-store.s3.prefix=jobs/")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final ResultStoreProperties store = context.getBean(ResultStoreProperties.class);
              assertThat(store.type()).isEqualTo("s3");
              assertThat(store.s3().bucket()).isEqualTo("registrar-results");
              assertThat(store.s3().prefix()).isEqualTo("jobs/");
            });
  }

  @Test
  void contextFailsOnUnknownResultStoreType() {
    contextRunner
        .withPropertyValues("registrar.result-store.type=ftp")
        .run(
            context -> {
              assertThat(context).hasFailed();
              final Throwable root =
                  org.assertj.core.util.Throwables.getRootCause(context.getStartupFailure());
              assertThat(root).isInstanceOf(IllegalArgumentException.class);
              assertThat(root.getMessage()).contains("ftp");
            });
  }

  @Configuration
  @EnableConfigurationProperties({
    JobProperties.class,
    ResultStoreProperties.class,
    LmsClientProperties.class
  })
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
