/*
 * どこで: Registrar ジョブ実行
 * 何を: スケジュールでジョブのメンテナンスを起動する
 * なぜ: 定期的に取りこぼしと期限切れを処理するため
 */
package org.openreg.registrar.job;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "registrar.jobs.maintenance-enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class JobMaintenanceWorker {

  private static final Logger logger = LoggerFactory.getLogger(JobMaintenanceWorker.class);

  private final JobMaintenanceService maintenanceService;

  @Scheduled(fixedDelayString = "${registrar.jobs.maintenance-interval:1m}")
  public void run() {
    try {
      maintenanceService.failTimedOut();
      maintenanceService.redispatchStalePending();
    } catch (RuntimeException ex) {
      logger.warn("job maintenance failed", ex);
    }
  }
}
