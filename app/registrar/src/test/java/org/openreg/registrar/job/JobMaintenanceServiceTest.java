/*
 * どこで: JobMaintenanceService の単体テスト
 * 何を: 取りこぼした PENDING の再投入と、期限切れ IN_PROGRESS の FAILED 化を検証する
 * なぜ: 実行器の停止やキュー溢れがあってもジョブが終端状態へ到達することを保証するため
 */
package org.openreg.registrar.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openreg.registrar.api.InvalidJobTransitionException;
import org.openreg.registrar.model.JobOperation;
import org.openreg.registrar.model.JobRecord;
import org.openreg.registrar.model.JobState;
import org.openreg.registrar.model.Organization;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.ProgramType;
import org.openreg.registrar.model.ResultRef;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.model.Subject;
import org.openreg.registrar.support.JobPipelineFixture;
import org.openreg.registrar.support.TestJobProperties;
import org.springframework.core.task.TaskRejectedException;

class JobMaintenanceServiceTest {

  private static final Subject OWNER = new Subject("owner", null, null, false);

  @TempDir Path resultRoot;

  private JobPipelineFixture fixture;
  private Program mba;

  @BeforeEach
  void setUp() {
    fixture = new JobPipelineFixture(resultRoot, TestJobProperties.withTimeout(Duration.ofMinutes(10)));
    final Organization acme = fixture.graph.organization("acme");
    mba = fixture.graph.program("acme-mba", ProgramType.MASTERS, acme);
    fixture.grants.insertRaw(OWNER.subjectId(), "program_manager", ScopeRef.organization(acme.id()));
  }

  @Test
  void stalePendingJobsAreRunAgain() {
    final JobRecord job = submitRead();

    assertThat(fixture.maintenance.redispatchStalePending()).isZero();

    fixture.clock.advance(Duration.ofMinutes(3));
    assertThat(fixture.maintenance.redispatchStalePending()).isEqualTo(1);
    assertThat(fixture.job(job.jobId()).state()).isEqualTo(JobState.SUCCEEDED);
  }

  @Test
  void jobWaitingInQueueIsNotQueuedAgain() {
    final List<Runnable> queue = new ArrayList<>();
    final JobDispatcher queueing = new JobDispatcher(queue::add, fixture.runner);
    final JobMaintenanceService maintenance =
        new JobMaintenanceService(
            fixture.jobs, fixture.registry, queueing, fixture.properties, fixture.clock);
    final JobRecord job = submitRead();
    assertThat(queueing.dispatch(job.jobId())).isTrue();

    for (int i = 0; i < 5; i++) {
      fixture.clock.advance(Duration.ofMinutes(3));
      assertThat(maintenance.redispatchStalePending()).isZero();
    }
    assertThat(queue).hasSize(1);

    queue.get(0).run();
    assertThat(fixture.job(job.jobId()).state()).isEqualTo(JobState.SUCCEEDED);
    assertThat(queueing.isQueued(job.jobId())).isFalse();
  }

  @Test
  void rejectedJobCanBeQueuedByLaterSweep() {
    final JobRecord job = submitRead();
    final List<Runnable> queue = new ArrayList<>();
    final JobDispatcher saturated =
        new JobDispatcher(
            task -> {
              throw new TaskRejectedException("queue full");
            },
            fixture.runner);
    assertThat(saturated.dispatch(job.jobId())).isFalse();
    assertThat(saturated.isQueued(job.jobId())).isFalse();

    final JobDispatcher recovered = new JobDispatcher(queue::add, fixture.runner);
    final JobMaintenanceService maintenance =
        new JobMaintenanceService(
            fixture.jobs, fixture.registry, recovered, fixture.properties, fixture.clock);
    fixture.clock.advance(Duration.ofMinutes(3));

    assertThat(maintenance.redispatchStalePending()).isEqualTo(1);
    assertThat(queue).hasSize(1);
  }

  @Test
  void inProgressJobsPastTimeoutAndGraceAreFailed() {
    final JobRecord job = submitRead();
    fixture.registry.claim(job.jobId()).orElseThrow();

    fixture.clock.advance(Duration.ofMinutes(12));
    assertThat(fixture.maintenance.failTimedOut()).isZero();

    fixture.clock.advance(Duration.ofMinutes(4));
    assertThat(fixture.maintenance.failTimedOut()).isEqualTo(1);

    final JobRecord failed = fixture.job(job.jobId());
    assertThat(failed.state()).isEqualTo(JobState.FAILED);
    assertThat(failed.message()).startsWith("TIMED_OUT");
    // 遅れて完了した実行器は確定できない
    assertThatThrownBy(
            () ->
                fixture.registry.transition(
                    job.jobId(), JobState.SUCCEEDED, new ResultRef("job-results/late.json"), "late"))
        .isInstanceOf(InvalidJobTransitionException.class);
    assertThat(fixture.job(job.jobId()).state()).isEqualTo(JobState.FAILED);
  }

  @Test
  void rejectedDispatchLeavesJobPending() {
    final JobRecord job = submitRead();
    final JobDispatcher saturated =
        new JobDispatcher(
            task -> {
              throw new TaskRejectedException("queue full");
            },
            fixture.runner);

    assertThat(saturated.dispatch(job.jobId())).isFalse();
    assertThat(fixture.job(job.jobId()).state()).isEqualTo(JobState.PENDING);
  }

  @Test
  void dispatchOfUnknownJobIsHarmless() {
    assertThat(fixture.dispatcher.dispatch(UUID.randomUUID())).isTrue();
  }

  private JobRecord submitRead() {
    return fixture.registry.create(
        OWNER, JobOperation.READ_ENROLLMENTS, ScopeRef.program(mba.id()), "{}");
  }
}
