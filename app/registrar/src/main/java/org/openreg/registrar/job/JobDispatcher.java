/*
 * どこで: Registrar ジョブ実行
 * 何を: 投入済みジョブをワーカープールへ渡す
 * なぜ: 投入リクエストを実行完了まで待たせないため
 */
package org.openreg.registrar.job;

import com.google.common.annotations.VisibleForTesting;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class JobDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(JobDispatcher.class);

  private final TaskExecutor jobTaskExecutor;
  private final JobRunner jobRunner;
  // キュー投入済みで未完了のジョブ
  private final Set<UUID> queued = ConcurrentHashMap.newKeySet();

  public JobDispatcher(
      @Qualifier("jobTaskExecutor") TaskExecutor jobTaskExecutor, JobRunner jobRunner) {
    this.jobTaskExecutor = jobTaskExecutor;
    this.jobRunner = jobRunner;
  }

  // トランザクション内で投入された場合はコミット後に実行する
  @TransactionalEventListener(fallbackExecution = true)
  public void onJobSubmitted(JobSubmittedEvent event) {
    dispatch(event.jobId());
  }

  /**
   * キューへ投入できた場合だけ true。
   * 既にキュー上にあるジョブは重複投入しない。キューが満杯なら PENDING のまま残り、メンテナンスで再投入される。
   */
  public boolean dispatch(UUID jobId) {
    if (!queued.add(jobId)) {
      logger.debug("job already queued jobId={}", jobId);
      return false;
    }
    try {
      jobTaskExecutor.execute(
          () -> {
            try {
              jobRunner.run(jobId);
            } finally {
              queued.remove(jobId);
            }
          });
      return true;
    } catch (TaskRejectedException ex) {
      queued.remove(jobId);
      logger.warn("job dispatch rejected jobId={}", jobId, ex);
      return false;
    }
  }

  @VisibleForTesting
  boolean isQueued(UUID jobId) {
    return queued.contains(jobId);
  }
}
