/*
 * どこで: Registrar データアクセス
 * 何を: subjects の遅延作成と最終アクセス更新を行う
 * なぜ: 認証済み呼び出し元を初回アクセス時に記録するため
 */
package org.openreg.registrar.repository;

import static org.openreg.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SubjectRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 新規作成された場合 true。既存なら属性と last_seen_at のみ更新する。 */
  public boolean upsert(String subjectId, String username, String email, Instant seenAt) {
    final String sql =
        """
        INSERT INTO subjects (subject_id, username, email, created_at, last_seen_at)
        VALUES (:subjectId, :username, :email, :seenAt, :seenAt)
        ON CONFLICT (subject_id)
        DO UPDATE SET
          username = COALESCE(EXCLUDED.username, subjects.username),
          email = COALESCE(EXCLUDED.email, subjects.email),
          last_seen_at = EXCLUDED.last_seen_at
        RETURNING (xmax = 0) AS inserted
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subjectId", subjectId)
            .addValue("username", username)
            .addValue("email", email)
            .addValue("seenAt", toTimestamp(seenAt));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }
}
