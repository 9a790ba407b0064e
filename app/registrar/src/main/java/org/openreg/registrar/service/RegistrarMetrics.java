/*
 * どこで: Registrar サービス層
 * 何を: 認可判定とジョブ処理のメトリクス記録を集約する
 * なぜ: 拒否率やジョブ失敗/所要時間を運用で継続監視できるようにするため
 */
package org.openreg.registrar.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class RegistrarMetrics {

  private static final String METRIC_AUTHORIZATION_TOTAL = "registrar.authorization.total";
  private static final String METRIC_JOB_SUBMITTED_TOTAL = "registrar.job.submitted.total";
  private static final String METRIC_JOB_COMPLETED_TOTAL = "registrar.job.completed.total";
  private static final String METRIC_JOB_DURATION = "registrar.job.duration";
  private static final String METRIC_JOB_RUNNING_CURRENT = "registrar.job.running.current";
  private static final String METRIC_DOWNSTREAM_ERROR_TOTAL = "registrar.downstream.error.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger runningJobs = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> durationTimers = new ConcurrentHashMap<>();

  public RegistrarMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_JOB_RUNNING_CURRENT, runningJobs, AtomicInteger::get)
        .description("Jobs currently executing on this node")
        .register(meterRegistry);
  }

  public void recordAuthorization(String action, boolean granted) {
    increment(
        METRIC_AUTHORIZATION_TOTAL,
        "Permission resolver decisions",
        Tags.of("action", action, "result", granted ? "granted" : "denied"));
  }

  public void recordJobSubmitted(String operation) {
    increment(METRIC_JOB_SUBMITTED_TOTAL, "Submitted jobs", Tags.of("operation", operation));
  }

  public void recordJobCompleted(String operation, String state, Instant startedAt, Instant at) {
    increment(
        METRIC_JOB_COMPLETED_TOTAL,
        "Jobs reaching a terminal state",
        Tags.of("operation", operation, "state", state));
    if (startedAt == null || at == null || at.isBefore(startedAt)) {
      return;
    }
    durationTimers
        .computeIfAbsent(
            operation,
            ignored ->
                Timer.builder(METRIC_JOB_DURATION)
                    .description("Wall-clock time from job start to completion")
                    .tags(Tags.of("operation", operation))
                    .register(meterRegistry))
        .record(Duration.between(startedAt, at));
  }

  public void recordDownstreamError(String reason) {
    increment(
        METRIC_DOWNSTREAM_ERROR_TOTAL,
        "Fatal errors returned by the enrollment provider",
        Tags.of("reason", reason));
  }

  public void jobStarted() {
    runningJobs.incrementAndGet();
  }

  public void jobFinished() {
    runningJobs.updateAndGet(current -> Math.max(current - 1, 0));
  }

  private void increment(String name, String description, Tags tags) {
    final String key = name + tags;
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(name).description(description).tags(tags).register(meterRegistry))
        .increment();
  }
}
