/*
 * どこで: Registrar テスト支援
 * 何を: 登録簿・実行器・保存先をメモリ実装で組み立てる
 * なぜ: ジョブのライフサイクル全体を Spring なしで同期的に検証するため
 */
package org.openreg.registrar.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.openreg.registrar.config.JobProperties;
import org.openreg.registrar.job.EnrollmentReportHandler;
import org.openreg.registrar.job.JobDispatcher;
import org.openreg.registrar.job.JobHandlers;
import org.openreg.registrar.job.JobMaintenanceService;
import org.openreg.registrar.job.JobRunner;
import org.openreg.registrar.job.JobSubmittedEvent;
import org.openreg.registrar.job.ReadEnrollmentsHandler;
import org.openreg.registrar.job.WriteEnrollmentsHandler;
import org.openreg.registrar.model.JobRecord;
import org.openreg.registrar.service.JobRegistry;
import org.openreg.registrar.service.PermissionResolver;
import org.openreg.registrar.service.RegistrarMetrics;
import org.openreg.registrar.service.RoleCatalog;
import org.openreg.registrar.store.FileSystemResultStore;
import org.springframework.core.task.SyncTaskExecutor;

public class JobPipelineFixture {

  public static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

  public final MutableClock clock = new MutableClock(T0);
  public final InMemoryEntityGraphRepository graph = new InMemoryEntityGraphRepository();
  public final InMemoryAccessGrantRepository grants = new InMemoryAccessGrantRepository();
  public final InMemoryJobRepository jobs = new InMemoryJobRepository();
  public final FakeEnrollmentDataProvider lms = new FakeEnrollmentDataProvider();
  public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  public final ObjectMapper objectMapper = new ObjectMapper();
  public final List<UUID> submitted = new ArrayList<>();
  public final FileSystemResultStore resultStore;
  public final JobProperties properties;
  public final PermissionResolver resolver;
  public final JobRegistry registry;
  public final JobRunner runner;
  public final JobDispatcher dispatcher;
  public final JobMaintenanceService maintenance;

  public JobPipelineFixture(Path resultRoot, JobProperties properties) {
    this.properties = properties;
    this.resultStore = new FileSystemResultStore(resultRoot);
    final RegistrarMetrics metrics = new RegistrarMetrics(meterRegistry);
    final JobHandlers handlers =
        new JobHandlers(
            List.of(
                new ReadEnrollmentsHandler(lms, objectMapper),
                new WriteEnrollmentsHandler(lms, properties, objectMapper),
                new EnrollmentReportHandler(lms, graph, objectMapper)));
    this.resolver = new PermissionResolver(graph, grants, new RoleCatalog(), metrics);
    this.registry =
        new JobRegistry(
            jobs,
            resolver,
            handlers,
            resultStore,
            event -> submitted.add(((JobSubmittedEvent) event).jobId()),
            metrics,
            properties,
            clock);
    this.runner =
        new JobRunner(
            registry, handlers, jobs, graph, resultStore, objectMapper, properties, metrics, clock);
    this.dispatcher = new JobDispatcher(new SyncTaskExecutor(), runner);
    this.maintenance = new JobMaintenanceService(jobs, registry, dispatcher, properties, clock);
  }

  public JobRecord job(UUID jobId) {
    return jobs.findById(jobId).orElseThrow();
  }
}
