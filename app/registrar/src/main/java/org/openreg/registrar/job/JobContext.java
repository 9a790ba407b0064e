/*
 * どこで: Registrar ジョブ実行
 * 何を: 実行中ジョブの対象・期限・中止要求確認を提供する
 * なぜ: ハンドラがページ/バッチ境界で協調的に中断できるようにするため
 */
package org.openreg.registrar.job;

import java.time.Clock;
import java.time.Instant;
import org.openreg.registrar.model.JobRecord;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.repository.JobRepository;

public final class JobContext {

  private final JobRecord job;
  private final Program program;
  private final Instant deadline;
  private final Clock clock;
  private final JobRepository jobRepository;

  public JobContext(
      JobRecord job, Program program, Instant deadline, Clock clock, JobRepository jobRepository) {
    this.job = job;
    this.program = program;
    this.deadline = deadline;
    this.clock = clock;
    this.jobRepository = jobRepository;
  }

  public JobRecord job() {
    return job;
  }

  /** 対象がプログラムのジョブでのみ非 null。 */
  public Program program() {
    return program;
  }

  public Program requireProgram() {
    if (program == null) {
      throw new JobExecutionException(
          JobExecutionException.FailureCode.INVALID_INPUT,
          "operation " + job.operation() + " requires a program target",
          null,
          null);
    }
    return program;
  }

  public Instant deadline() {
    return deadline;
  }

  public Instant now() {
    return Instant.now(clock);
  }

  public void checkpoint() {
    if (jobRepository.isCancelRequested(job.jobId())) {
      throw JobExecutionException.cancelled();
    }
    if (!now().isBefore(deadline)) {
      throw JobExecutionException.timedOut(deadline);
    }
  }
}
