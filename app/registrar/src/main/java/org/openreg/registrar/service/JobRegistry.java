/*
 * どこで: Registrar ジョブ登録簿
 * 何を: ジョブの投入・状態遷移・参照・中止要求・成果物取得を提供する
 * なぜ: 認可済みの投入だけを受け付け、状態遷移を CAS で一意に確定させるため
 */
package org.openreg.registrar.service;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.api.InvalidJobTransitionException;
import org.openreg.registrar.api.JobNotFoundException;
import org.openreg.registrar.api.JobResultNotReadyException;
import org.openreg.registrar.api.ScopeNotFoundException;
import org.openreg.registrar.api.UnauthorizedActionException;
import org.openreg.registrar.config.JobProperties;
import org.openreg.registrar.job.JobHandlers;
import org.openreg.registrar.job.JobSubmittedEvent;
import org.openreg.registrar.model.AuthorizationDecision;
import org.openreg.registrar.model.InternalPermission;
import org.openreg.registrar.model.JobOperation;
import org.openreg.registrar.model.JobRecord;
import org.openreg.registrar.model.JobState;
import org.openreg.registrar.model.JobView;
import org.openreg.registrar.model.ResultRef;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.model.Subject;
import org.openreg.registrar.repository.JobRepository;
import org.openreg.registrar.store.ResultStore;
import org.openreg.registrar.store.StoredResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobRegistry {

  private static final Logger logger = LoggerFactory.getLogger(JobRegistry.class);
  private static final int MAX_LIST_LIMIT = 100;

  private final JobRepository jobRepository;
  private final PermissionResolver permissionResolver;
  private final JobHandlers jobHandlers;
  private final ResultStore resultStore;
  private final ApplicationEventPublisher eventPublisher;
  private final RegistrarMetrics metrics;
  private final JobProperties properties;
  private final Clock clock;

  /**
   * 役割: ジョブを PENDING で登録し、ワーカーへ渡す。
   * 動作: 実行完了を待たずに登録済みレコードを返す。
   * 例外: 認可されない場合 UnauthorizedActionException、対象が存在しない場合 ScopeNotFoundException。
   */
  public JobRecord create(
      Subject subject, JobOperation operation, ScopeRef target, String inputJson) {
    if (!operation.supports(target.kind())) {
      throw new IllegalArgumentException(
          "operation " + operation.name().toLowerCase() + " does not accept target " + target);
    }
    final AuthorizationDecision decision =
        permissionResolver.resolve(subject.subjectId(), target, operation.requiredPermission());
    if (!decision.granted()) {
      logger.info(
          "job submission denied subjectId={} operation={} target={}",
          subject.subjectId(),
          operation,
          target);
      throw new UnauthorizedActionException(
          "subject lacks " + operation.requiredPermission().value() + " on " + target);
    }
    jobHandlers.require(operation).validateInput(inputJson);
    final JobRecord job =
        JobRecord.pending(
            UUID.randomUUID(), subject.subjectId(), operation, target, inputJson, Instant.now(clock));
    jobRepository.insert(job);
    metrics.recordJobSubmitted(operation.name());
    logger.info(
        "job submitted jobId={} operation={} target={} subjectId={}",
        job.jobId(),
        operation,
        target,
        subject.subjectId());
    eventPublisher.publishEvent(new JobSubmittedEvent(job.jobId()));
    return job;
  }

  /**
   * 役割: ジョブ実行器からの状態遷移を確定する。
   * 動作: 遷移グラフを検証し、現在状態を期待値とする CAS で書き込む。
   * 例外: 不正な遷移または競合負けは InvalidJobTransitionException (行は変更しない)。
   */
  public JobRecord transition(UUID jobId, JobState next, ResultRef resultRef, String message) {
    final JobRecord current =
        jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId.toString()));
    final JobRecord updated;
    try {
      updated = current.transitionTo(next, resultRef, truncate(message), Instant.now(clock));
    } catch (InvalidJobTransitionException ex) {
      logger.error(
          "illegal job transition jobId={} from={} to={}", jobId, current.state(), next, ex);
      throw ex;
    }
    if (!jobRepository.compareAndSetState(current.state(), updated)) {
      final InvalidJobTransitionException ex =
          new InvalidJobTransitionException(
              "job " + jobId + " changed concurrently; expected " + current.state());
      logger.error(
          "job transition lost compare-and-set jobId={} expected={} to={}",
          jobId,
          current.state(),
          next,
          ex);
      throw ex;
    }
    if (next.isTerminal()) {
      metrics.recordJobCompleted(
          updated.operation().name(), next.name(), updated.startedAt(), updated.finishedAt());
    }
    logger.info("job transitioned jobId={} from={} to={}", jobId, current.state(), next);
    return updated;
  }

  /** PENDING のジョブを IN_PROGRESS として確保する。他のワーカーが確保済みなら空。 */
  public Optional<JobRecord> claim(UUID jobId) {
    final JobRecord current = jobRepository.findById(jobId).orElse(null);
    if (current == null || current.state() != JobState.PENDING) {
      return Optional.empty();
    }
    final JobRecord started = current.start(Instant.now(clock));
    if (!jobRepository.compareAndSetState(JobState.PENDING, started)) {
      logger.debug("job claim lost to another worker jobId={}", jobId);
      return Optional.empty();
    }
    logger.info("job transitioned jobId={} from={} to={}", jobId, JobState.PENDING, started.state());
    return Optional.of(started);
  }

  /** 所有者と管理権限 (全体管理者、または対象スコープのジョブ監査ロール) にだけ見える。 */
  public JobView get(Subject subject, UUID jobId) {
    return toView(requireVisible(subject, jobId));
  }

  public List<JobView> listOwned(Subject subject, int limit) {
    final int bounded = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
    return jobRepository.findByOwner(subject.subjectId(), bounded).stream()
        .map(this::toView)
        .toList();
  }

  /** 中止要求は助言的で、ジョブは最終的に FAILED (cancelled) になる。 */
  public JobView cancel(Subject subject, UUID jobId) {
    final JobRecord job = requireVisible(subject, jobId);
    if (!isOwnerOrAdministrator(subject, job)) {
      throw new UnauthorizedActionException("only the job owner can cancel job " + jobId);
    }
    if (job.state().isTerminal() || !jobRepository.requestCancel(jobId, Instant.now(clock))) {
      throw new InvalidJobTransitionException("job " + jobId + " is already finished");
    }
    logger.info(
        "job cancel requested jobId={} state={} subjectId={}",
        jobId,
        job.state(),
        subject.subjectId());
    return get(subject, jobId);
  }

  public StoredResult fetchResult(Subject subject, UUID jobId) {
    final JobRecord job = requireVisible(subject, jobId);
    if (job.resultRef() == null) {
      throw new JobResultNotReadyException(jobId.toString(), job.state().name());
    }
    return resultStore.get(job.resultRef());
  }

  private JobRecord requireVisible(Subject subject, UUID jobId) {
    final JobRecord job =
        jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId.toString()));
    if (isOwnerOrAdministrator(subject, job) || holdsJobOverride(subject, job.target())) {
      return job;
    }
    // 権限のない主体にはジョブの存在自体を隠す
    throw new JobNotFoundException(jobId.toString());
  }

  private boolean isOwnerOrAdministrator(Subject subject, JobRecord job) {
    return subject.administrator() || subject.subjectId().equals(job.ownerSubjectId());
  }

  private boolean holdsJobOverride(Subject subject, ScopeRef target) {
    try {
      return permissionResolver.resolveInternal(subject.subjectId(), target).stream()
          .anyMatch(InternalPermission::isJobVisibility);
    } catch (ScopeNotFoundException ex) {
      return false;
    }
  }

  private JobView toView(JobRecord job) {
    final ResultRef ref = job.resultRef();
    final URI downloadUrl =
        ref == null ? null : resultStore.downloadUrl(ref, properties.resultUrlTtl()).orElse(null);
    return new JobView(
        job.jobId(),
        job.operation(),
        job.target(),
        job.state(),
        job.message(),
        job.cancelRequested(),
        job.createdAt(),
        job.updatedAt(),
        ref,
        downloadUrl);
  }

  private String truncate(String message) {
    if (message == null) {
      return null;
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }
}
