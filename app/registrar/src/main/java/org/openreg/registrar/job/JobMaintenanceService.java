/*
 * どこで: Registrar ジョブ実行
 * 何を: 取りこぼした PENDING の再投入と、期限切れ IN_PROGRESS の FAILED 化を行う
 * なぜ: プロセス再起動やキュー溢れがあってもジョブを終端状態へ到達させるため
 */
package org.openreg.registrar.job;

import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.api.InvalidJobTransitionException;
import org.openreg.registrar.config.JobProperties;
import org.openreg.registrar.model.JobRecord;
import org.openreg.registrar.model.JobState;
import org.openreg.registrar.repository.JobRepository;
import org.openreg.registrar.service.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobMaintenanceService {

  private static final Logger logger = LoggerFactory.getLogger(JobMaintenanceService.class);

  private final JobRepository jobRepository;
  private final JobRegistry jobRegistry;
  private final JobDispatcher jobDispatcher;
  private final JobProperties properties;
  private final Clock clock;

  public int redispatchStalePending() {
    final Instant threshold = Instant.now(clock).minus(properties.dispatchGrace());
    int dispatched = 0;
    for (JobRecord job :
        jobRepository.findPendingCreatedBefore(threshold, properties.maintenanceBatchSize())) {
      if (jobDispatcher.dispatch(job.jobId())) {
        dispatched++;
      }
    }
    if (dispatched > 0) {
      logger.info("stale pending jobs re-dispatched count={}", dispatched);
    }
    return dispatched;
  }

  public int failTimedOut() {
    final Instant threshold =
        Instant.now(clock).minus(properties.timeout()).minus(properties.finalizeGrace());
    int failed = 0;
    for (JobRecord job :
        jobRepository.findInProgressStartedBefore(threshold, properties.maintenanceBatchSize())) {
      try {
        jobRegistry.transition(
            job.jobId(), JobState.FAILED, null, "TIMED_OUT: job exceeded " + properties.timeout());
        failed++;
        logger.warn("timed out job marked failed jobId={} startedAt={}", job.jobId(), job.startedAt());
      } catch (InvalidJobTransitionException ex) {
        // 実行器が同時に確定した。登録簿側で記録済み
        logger.debug("timed out job already finalized jobId={}", job.jobId());
      }
    }
    return failed;
  }
}
