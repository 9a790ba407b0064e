/*
 * どこで: ジョブパイプラインの統合テスト
 * 何を: 投入 → ワーカー実行 → 成果物保存 → 取得 までを実 DB とワーカープールで通す
 * なぜ: 投入イベントからの非同期ディスパッチと CAS による確定が配線込みで動くことを確認するため
 */
package org.openreg.registrar.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openreg.registrar.AbstractPostgresContainerTest;
import org.openreg.registrar.lms.DownstreamFailureException;
import org.openreg.registrar.lms.EnrollmentDataProvider;
import org.openreg.registrar.lms.EnrollmentPage;
import org.openreg.registrar.model.JobOperation;
import org.openreg.registrar.model.JobRecord;
import org.openreg.registrar.model.JobState;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.ProgramType;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.model.Subject;
import org.openreg.registrar.repository.JobRepository;
import org.openreg.registrar.service.AccessGrantService;
import org.openreg.registrar.service.EntityGraphService;
import org.openreg.registrar.service.JobRegistry;
import org.openreg.registrar.store.StoredResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class JobPipelineIntegrationTest extends AbstractPostgresContainerTest {

  private static final Duration WAIT_LIMIT = Duration.ofSeconds(15);

  @Autowired private JobRegistry jobRegistry;

  @Autowired private JobRepository jobRepository;

  @Autowired private EntityGraphService entityGraphService;

  @Autowired private AccessGrantService accessGrantService;

  @Autowired private ObjectMapper objectMapper;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @MockitoBean private EnrollmentDataProvider enrollmentDataProvider;

  private Program program;

  @BeforeEach
  void setUp() {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM jobs", none);
    jdbcTemplate.update("DELETE FROM access_grants", none);
    jdbcTemplate.update("DELETE FROM program_authoring_organizations", none);
    jdbcTemplate.update("DELETE FROM programs", none);
    jdbcTemplate.update("DELETE FROM organizations", none);

    entityGraphService.registerOrganization("mitx", UUID.randomUUID(), "MITx");
    program =
        entityGraphService.registerProgram(
            "data-masters", UUID.randomUUID(), "Data Masters", ProgramType.MASTERS, "mitx", List.of());
    accessGrantService.grant("alice", "program_read_enrollments", ScopeRef.program(program.id()));
  }

  @Test
  void readJobRunsOnWorkerAndStoresArtifact() throws Exception {
    final EnrollmentPage page =
        new EnrollmentPage(
            List.of(
                objectMapper.readTree("{\"student_key\":\"learner-001\",\"status\":\"enrolled\"}"),
                objectMapper.readTree("{\"student_key\":\"learner-002\",\"status\":\"pending\"}")),
            null);
    given(enrollmentDataProvider.fetchProgramEnrollments(eq(program.uuid()), isNull()))
        .willReturn(page);
    final Subject alice = new Subject("alice", null, null, false);

    final JobRecord job =
        jobRegistry.create(
            alice, JobOperation.READ_ENROLLMENTS, ScopeRef.program(program.id()), "{}");
    final JobRecord finished = awaitTerminal(job.jobId());

    assertThat(finished.state()).isEqualTo(JobState.SUCCEEDED);
    assertThat(finished.resultRef()).isNotNull();
    assertThat(finished.startedAt()).isNotNull();

    final StoredResult result = jobRegistry.fetchResult(alice, job.jobId());
    final JsonNode artifact = objectMapper.readTree(result.payload());
    assertThat(artifact.path("count").asInt()).isEqualTo(2);
    assertThat(artifact.path("enrollments").get(1).path("student_key").asText())
        .isEqualTo("learner-002");
  }

  @Test
  void downstreamFailureEndsInFailedWithErrorSummary() throws Exception {
    given(enrollmentDataProvider.fetchProgramEnrollments(eq(program.uuid()), any()))
        .willThrow(
            new DownstreamFailureException(
                DownstreamFailureException.Reason.SERVER_ERROR, "lms server error status=503"));
    final Subject alice = new Subject("alice", null, null, false);

    final JobRecord job =
        jobRegistry.create(
            alice, JobOperation.READ_ENROLLMENTS, ScopeRef.program(program.id()), "{}");
    final JobRecord finished = awaitTerminal(job.jobId());

    assertThat(finished.state()).isEqualTo(JobState.FAILED);
    assertThat(finished.message()).startsWith("DOWNSTREAM_FAILURE");
    final JsonNode summary =
        objectMapper.readTree(jobRegistry.fetchResult(alice, job.jobId()).payload());
    assertThat(summary.path("error").path("code").asText()).isEqualTo("DOWNSTREAM_FAILURE");
  }

  private JobRecord awaitTerminal(UUID jobId) throws InterruptedException {
    final Instant deadline = Instant.now().plus(WAIT_LIMIT);
    while (Instant.now().isBefore(deadline)) {
      final JobRecord job = jobRepository.findById(jobId).orElseThrow();
      if (job.state().isTerminal()) {
        return job;
      }
      Thread.sleep(100);
    }
    throw new AssertionError("job " + jobId + " did not finish within " + WAIT_LIMIT);
  }
}
