/*
 * どこで: Registrar データアクセス
 * 何を: jobs テーブルの登録/参照/条件付き更新を行う
 * なぜ: WHERE state = :expected による CAS で終端状態の二重確定を防ぐため
 */
package org.openreg.registrar.repository;

import static org.openreg.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.openreg.common.JdbcTimestampUtils;
import org.openreg.registrar.model.JobOperation;
import org.openreg.registrar.model.JobRecord;
import org.openreg.registrar.model.JobState;
import org.openreg.registrar.model.ResultRef;
import org.openreg.registrar.model.ScopeKind;
import org.openreg.registrar.model.ScopeRef;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcJobRepository implements JobRepository {

  private static final String COLUMNS =
      """
      job_id, owner_subject_id, operation, target_kind, target_id, state, input_json::text AS input_json,
      result_ref, message, cancel_requested, created_at, updated_at, started_at, finished_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void insert(JobRecord job) {
    final String sql =
        """
        INSERT INTO jobs (
          job_id,
          owner_subject_id,
          operation,
          target_kind,
          target_id,
          state,
          input_json,
          result_ref,
          message,
          cancel_requested,
          created_at,
          updated_at
        ) VALUES (
          :jobId,
          :ownerSubjectId,
          :operation,
          :targetKind,
          :targetId,
          :state,
          CAST(:inputJson AS jsonb),
          NULL,
          NULL,
          FALSE,
          :createdAt,
          :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", job.jobId())
            .addValue("ownerSubjectId", job.ownerSubjectId())
            .addValue("operation", job.operation().name())
            .addValue("targetKind", job.target().kind().name())
            .addValue("targetId", job.target().id())
            .addValue("state", job.state().name())
            .addValue("inputJson", job.inputJson())
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("updatedAt", toTimestamp(job.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<JobRecord> findById(UUID jobId) {
    final String sql = "SELECT " + COLUMNS + " FROM jobs WHERE job_id = :jobId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("jobId", jobId), this::mapRow)
        .stream()
        .findFirst();
  }

  @Override
  public boolean compareAndSetState(JobState expected, JobRecord next) {
    final String sql =
        """
        UPDATE jobs
        SET state = :state,
            result_ref = :resultRef,
            message = :message,
            updated_at = :updatedAt,
            started_at = :startedAt,
            finished_at = :finishedAt
        WHERE job_id = :jobId
          AND state = :expected
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", next.jobId())
            .addValue("expected", expected.name())
            .addValue("state", next.state().name())
            .addValue("resultRef", next.resultRef() == null ? null : next.resultRef().value())
            .addValue("message", next.message())
            .addValue("updatedAt", toTimestamp(next.updatedAt()))
            .addValue("startedAt", toTimestamp(next.startedAt()))
            .addValue("finishedAt", toTimestamp(next.finishedAt()));
    return jdbcTemplate.update(sql, params) == 1;
  }

  @Override
  public boolean requestCancel(UUID jobId, Instant requestedAt) {
    final String sql =
        """
        UPDATE jobs
        SET cancel_requested = TRUE,
            updated_at = :requestedAt
        WHERE job_id = :jobId
          AND state IN ('PENDING', 'IN_PROGRESS')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("requestedAt", toTimestamp(requestedAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  @Override
  public boolean isCancelRequested(UUID jobId) {
    final String sql = "SELECT cancel_requested FROM jobs WHERE job_id = :jobId";
    return jdbcTemplate
        .queryForList(sql, new MapSqlParameterSource("jobId", jobId), Boolean.class)
        .stream()
        .findFirst()
        .orElse(false);
  }

  @Override
  public List<JobRecord> findByOwner(String ownerSubjectId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM jobs WHERE owner_subject_id = :ownerSubjectId"
            + " ORDER BY created_at DESC LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerSubjectId", ownerSubjectId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public List<JobRecord> findPendingCreatedBefore(Instant threshold, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM jobs WHERE state = 'PENDING' AND created_at < :threshold"
            + " ORDER BY created_at LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public List<JobRecord> findInProgressStartedBefore(Instant threshold, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM jobs WHERE state = 'IN_PROGRESS' AND started_at < :threshold"
            + " ORDER BY started_at LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JobRecord(
        rs.getObject("job_id", UUID.class),
        rs.getString("owner_subject_id"),
        JobOperation.valueOf(rs.getString("operation")),
        new ScopeRef(ScopeKind.valueOf(rs.getString("target_kind")), rs.getLong("target_id")),
        JobState.valueOf(rs.getString("state")),
        rs.getString("input_json"),
        ResultRef.ofNullable(rs.getString("result_ref")),
        rs.getString("message"),
        rs.getBoolean("cancel_requested"),
        JdbcTimestampUtils.getInstant(rs, "created_at"),
        JdbcTimestampUtils.getInstant(rs, "updated_at"),
        JdbcTimestampUtils.getInstant(rs, "started_at"),
        JdbcTimestampUtils.getInstant(rs, "finished_at"));
  }
}
