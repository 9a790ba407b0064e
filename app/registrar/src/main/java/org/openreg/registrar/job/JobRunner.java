/*
 * どこで: Registrar ジョブ実行
 * 何を: ジョブ 1 件を確保し、ハンドラ実行・成果物保存・状態確定まで行う
 * なぜ: 要求処理から切り離してジョブを必ず終端状態へ到達させるため
 */
package org.openreg.registrar.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.api.InvalidJobTransitionException;
import org.openreg.registrar.config.JobProperties;
import org.openreg.registrar.model.JobRecord;
import org.openreg.registrar.model.JobState;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.ResultRef;
import org.openreg.registrar.model.ScopeKind;
import org.openreg.registrar.repository.EntityGraphRepository;
import org.openreg.registrar.repository.JobRepository;
import org.openreg.registrar.service.JobRegistry;
import org.openreg.registrar.service.RegistrarMetrics;
import org.openreg.registrar.store.ResultStore;
import org.openreg.registrar.store.ResultStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobRunner {

  private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);
  private static final String MDC_JOB_ID = "job_id";
  private static final String MDC_JOB_OPERATION = "job_operation";

  private final JobRegistry jobRegistry;
  private final JobHandlers jobHandlers;
  private final JobRepository jobRepository;
  private final EntityGraphRepository entityGraphRepository;
  private final ResultStore resultStore;
  private final ObjectMapper objectMapper;
  private final JobProperties properties;
  private final RegistrarMetrics metrics;
  private final Clock clock;

  public void run(UUID jobId) {
    MDC.put(MDC_JOB_ID, jobId.toString());
    try {
      final Optional<JobRecord> claimed = jobRegistry.claim(jobId);
      if (claimed.isEmpty()) {
        logger.debug("job skipped because it is not pending jobId={}", jobId);
        return;
      }
      execute(claimed.get());
    } finally {
      MDC.remove(MDC_JOB_OPERATION);
      MDC.remove(MDC_JOB_ID);
    }
  }

  private void execute(JobRecord job) {
    MDC.put(MDC_JOB_OPERATION, job.operation().name());
    metrics.jobStarted();
    try {
      final JobArtifact artifact = produce(job);
      final ResultRef ref;
      try {
        ref = upload(job.jobId(), artifact);
      } finally {
        Files.deleteIfExists(artifact.file());
      }
      finish(job.jobId(), JobState.SUCCEEDED, ref, artifact.summary());
    } catch (JobExecutionException ex) {
      fail(job, ex);
    } catch (ResultStoreException ex) {
      logger.error("job result could not be stored jobId={}", job.jobId(), ex);
      finish(job.jobId(), JobState.FAILED, null, "INTERNAL_ERROR: result store unavailable");
    } catch (IOException | RuntimeException ex) {
      logger.error("job execution failed unexpectedly jobId={}", job.jobId(), ex);
      fail(
          job,
          new JobExecutionException(
              JobExecutionException.FailureCode.INTERNAL_ERROR, "unexpected error", null, ex));
    } finally {
      metrics.jobFinished();
    }
  }

  private JobArtifact produce(JobRecord job) throws IOException {
    if (job.cancelRequested()) {
      throw JobExecutionException.cancelled();
    }
    Program program = null;
    if (job.target().kind() == ScopeKind.PROGRAM) {
      program =
          entityGraphRepository
              .findProgramById(job.target().id())
              .orElseThrow(
                  () ->
                      new JobExecutionException(
                          JobExecutionException.FailureCode.INVALID_INPUT,
                          "target program no longer exists",
                          null,
                          null));
    }
    final JobContext context =
        new JobContext(
            job, program, job.startedAt().plus(properties.timeout()), clock, jobRepository);
    return jobHandlers.require(job.operation()).execute(context);
  }

  private ResultRef upload(UUID jobId, JobArtifact artifact) throws IOException {
    try (InputStream in = Files.newInputStream(artifact.file())) {
      return resultStore.put(jobId, in, Files.size(artifact.file()), artifact.contentType());
    }
  }

  private void fail(JobRecord job, JobExecutionException ex) {
    switch (ex.code()) {
      case CANCELLED -> logger.info("job cancelled jobId={}", job.jobId());
      case DOWNSTREAM_FAILURE -> {
        metrics.recordDownstreamError(String.valueOf(ex.details().get("reason")));
        logger.warn("job failed by downstream error jobId={} details={}", job.jobId(), ex.details(), ex);
      }
      case INTERNAL_ERROR -> logger.error("job failed jobId={}", job.jobId(), ex);
      default -> logger.warn("job failed jobId={} code={} message={}", job.jobId(), ex.code(), ex.getMessage());
    }
    // 失敗時はエラー要約のみを成果物として残す
    ResultRef ref = null;
    try {
      ref =
          resultStore.put(
              job.jobId(), errorSummary(job, ex), ArtifactWriter.CONTENT_TYPE_JSON);
    } catch (ResultStoreException | JsonProcessingException storeEx) {
      logger.warn("job error summary could not be stored jobId={}", job.jobId(), storeEx);
    }
    finish(job.jobId(), JobState.FAILED, ref, ex.code() + ": " + ex.getMessage());
  }

  private byte[] errorSummary(JobRecord job, JobExecutionException ex)
      throws JsonProcessingException {
    final Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", ex.code().name());
    error.put("message", ex.getMessage());
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("job_id", job.jobId().toString());
    body.put("state", JobState.FAILED.name());
    body.put("error", error);
    body.put("details", ex.details());
    return objectMapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
  }

  private void finish(UUID jobId, JobState state, ResultRef ref, String message) {
    try {
      jobRegistry.transition(jobId, state, ref, message);
    } catch (InvalidJobTransitionException ex) {
      // タイムアウト掃除など別経路で既に確定済み。登録簿側で ERROR 記録済み
      logger.warn("job finalization skipped jobId={} state={}", jobId, state);
      if (ref != null) {
        discardOrphan(jobId, ref);
      }
    }
  }

  // 確定に負けた側の成果物はどの行からも参照されない
  private void discardOrphan(UUID jobId, ResultRef ref) {
    final ResultRef stored =
        jobRepository.findById(jobId).map(JobRecord::resultRef).orElse(null);
    if (ref.equals(stored)) {
      return;
    }
    try {
      resultStore.delete(ref);
      logger.info("orphaned job result deleted jobId={} ref={}", jobId, ref);
    } catch (ResultStoreException ex) {
      logger.warn("orphaned job result could not be deleted jobId={} ref={}", jobId, ref, ex);
    }
  }
}
