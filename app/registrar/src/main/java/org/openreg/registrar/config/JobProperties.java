/*
 * どこで: Registrar 設定
 * 何を: ジョブ実行器とメンテナンスワーカーの設定を保持する
 * なぜ: ワーカー数・バッチ上限・タイムアウトを運用で調整できるようにするため
 */
package org.openreg.registrar.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "registrar.jobs")
public record JobProperties(
    int workerPoolSize,
    int queueCapacity,
    int writeBatchSize,
    Duration timeout,
    Duration finalizeGrace,
    Duration dispatchGrace,
    Duration maintenanceInterval,
    int maintenanceBatchSize,
    int errorMessageMaxLength,
    Duration resultUrlTtl) {

  public JobProperties {
    workerPoolSize = workerPoolSize <= 0 ? 4 : workerPoolSize;
    queueCapacity = queueCapacity <= 0 ? 100 : queueCapacity;
    writeBatchSize = writeBatchSize <= 0 ? 25 : writeBatchSize;
    timeout = timeout == null ? Duration.ofMinutes(30) : timeout;
    finalizeGrace = finalizeGrace == null ? Duration.ofMinutes(5) : finalizeGrace;
    dispatchGrace = dispatchGrace == null ? Duration.ofMinutes(2) : dispatchGrace;
    maintenanceInterval = maintenanceInterval == null ? Duration.ofMinutes(1) : maintenanceInterval;
    maintenanceBatchSize = maintenanceBatchSize <= 0 ? 50 : maintenanceBatchSize;
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
    resultUrlTtl = resultUrlTtl == null ? Duration.ofMinutes(15) : resultUrlTtl;
  }
}
