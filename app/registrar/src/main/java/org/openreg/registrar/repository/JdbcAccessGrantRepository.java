/*
 * どこで: Registrar データアクセス
 * 何を: access_grants の登録/削除/参照を行う
 * なぜ: 重複付与を DB 制約で冪等に吸収するため
 */
package org.openreg.registrar.repository;

import static org.openreg.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.openreg.common.JdbcTimestampUtils;
import org.openreg.registrar.model.AccessGrantRecord;
import org.openreg.registrar.model.ScopeKind;
import org.openreg.registrar.model.ScopeRef;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcAccessGrantRepository implements AccessGrantRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public boolean insertIfAbsent(
      String subjectId, String roleName, ScopeRef scope, Instant grantedAt) {
    final String sql =
        """
        INSERT INTO access_grants (subject_id, role_name, scope_kind, scope_id, granted_at)
        VALUES (:subjectId, :roleName, :scopeKind, :scopeId, :grantedAt)
        ON CONFLICT (subject_id, role_name, scope_kind, scope_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        grantParams(subjectId, roleName, scope).addValue("grantedAt", toTimestamp(grantedAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  @Override
  public boolean delete(String subjectId, String roleName, ScopeRef scope) {
    final String sql =
        """
        DELETE FROM access_grants
        WHERE subject_id = :subjectId
          AND role_name = :roleName
          AND scope_kind = :scopeKind
          AND scope_id = :scopeId
        """;
    return jdbcTemplate.update(sql, grantParams(subjectId, roleName, scope)) > 0;
  }

  @Override
  public List<AccessGrantRecord> findBySubject(String subjectId) {
    final String sql =
        """
        SELECT subject_id, role_name, scope_kind, scope_id, granted_at
        FROM access_grants
        WHERE subject_id = :subjectId
        ORDER BY granted_at, role_name
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("subjectId", subjectId), this::mapRow);
  }

  @Override
  public List<AccessGrantRecord> findBySubjectAndScopes(
      String subjectId, Collection<ScopeRef> scopes) {
    final List<Long> organizationIds = new ArrayList<>();
    final List<Long> programIds = new ArrayList<>();
    for (ScopeRef scope : scopes) {
      if (scope.kind() == ScopeKind.ORGANIZATION) {
        organizationIds.add(scope.id());
      } else {
        programIds.add(scope.id());
      }
    }
    if (organizationIds.isEmpty() && programIds.isEmpty()) {
      return List.of();
    }
    // IN () は構文エラーになるため、空側には存在しない ID を入れる
    final String sql =
        """
        SELECT subject_id, role_name, scope_kind, scope_id, granted_at
        FROM access_grants
        WHERE subject_id = :subjectId
          AND (
            (scope_kind = 'ORGANIZATION' AND scope_id IN (:organizationIds))
            OR (scope_kind = 'PROGRAM' AND scope_id IN (:programIds))
          )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subjectId", subjectId)
            .addValue("organizationIds", organizationIds.isEmpty() ? List.of(-1L) : organizationIds)
            .addValue("programIds", programIds.isEmpty() ? List.of(-1L) : programIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MapSqlParameterSource grantParams(String subjectId, String roleName, ScopeRef scope) {
    return new MapSqlParameterSource()
        .addValue("subjectId", subjectId)
        .addValue("roleName", roleName)
        .addValue("scopeKind", scope.kind().name())
        .addValue("scopeId", scope.id());
  }

  private AccessGrantRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AccessGrantRecord(
        rs.getString("subject_id"),
        rs.getString("role_name"),
        new ScopeRef(ScopeKind.valueOf(rs.getString("scope_kind")), rs.getLong("scope_id")),
        JdbcTimestampUtils.getInstant(rs, "granted_at"));
  }
}
