/*
 * どこで: Registrar ジョブモデル
 * 何を: ジョブ 1 件の永続状態と遷移関数を表す
 * なぜ: 結果参照のない SUCCEEDED のような不整合状態を生成できないようにするため
 */
package org.openreg.registrar.model;

import java.time.Instant;
import java.util.UUID;
import org.openreg.registrar.api.InvalidJobTransitionException;

public record JobRecord(
    UUID jobId,
    String ownerSubjectId,
    JobOperation operation,
    ScopeRef target,
    JobState state,
    String inputJson,
    ResultRef resultRef,
    String message,
    boolean cancelRequested,
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant finishedAt) {

  public JobRecord {
    if (jobId == null || operation == null || target == null || state == null) {
      throw new IllegalArgumentException("jobId, operation, target and state are required");
    }
    if (state == JobState.SUCCEEDED && resultRef == null) {
      throw new IllegalArgumentException("SUCCEEDED job requires a result reference");
    }
    if (!state.isTerminal() && resultRef != null) {
      throw new IllegalArgumentException(state + " job must not carry a result reference");
    }
  }

  public static JobRecord pending(
      UUID jobId,
      String ownerSubjectId,
      JobOperation operation,
      ScopeRef target,
      String inputJson,
      Instant now) {
    return new JobRecord(
        jobId,
        ownerSubjectId,
        operation,
        target,
        JobState.PENDING,
        inputJson,
        null,
        null,
        false,
        now,
        now,
        null,
        null);
  }

  public JobRecord start(Instant now) {
    guard(JobState.IN_PROGRESS);
    return new JobRecord(
        jobId,
        ownerSubjectId,
        operation,
        target,
        JobState.IN_PROGRESS,
        inputJson,
        null,
        message,
        cancelRequested,
        createdAt,
        now,
        now,
        null);
  }

  public JobRecord succeed(ResultRef ref, String summary, Instant now) {
    guard(JobState.SUCCEEDED);
    if (ref == null) {
      throw new InvalidJobTransitionException(
          "job " + jobId + " cannot succeed without a result reference");
    }
    return finish(JobState.SUCCEEDED, ref, summary, now);
  }

  // 失敗時の成果物 (エラー要約) は任意
  public JobRecord fail(ResultRef ref, String reason, Instant now) {
    guard(JobState.FAILED);
    return finish(JobState.FAILED, ref, reason, now);
  }

  public JobRecord transitionTo(JobState next, ResultRef ref, String text, Instant now) {
    return switch (next) {
      case IN_PROGRESS -> start(now);
      case SUCCEEDED -> succeed(ref, text, now);
      case FAILED -> fail(ref, text, now);
      case PENDING -> throw new InvalidJobTransitionException(
          "job " + jobId + " cannot transition " + state + " -> " + next);
    };
  }

  private JobRecord finish(JobState next, ResultRef ref, String text, Instant now) {
    return new JobRecord(
        jobId,
        ownerSubjectId,
        operation,
        target,
        next,
        inputJson,
        ref,
        text,
        cancelRequested,
        createdAt,
        now,
        startedAt,
        now);
  }

  private void guard(JobState next) {
    if (!state.canTransitionTo(next)) {
      throw new InvalidJobTransitionException(
          "job " + jobId + " cannot transition " + state + " -> " + next);
    }
  }
}
