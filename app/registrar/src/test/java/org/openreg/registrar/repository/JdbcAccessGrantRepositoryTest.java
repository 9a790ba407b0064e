/*
 * どこで: JdbcAccessGrantRepository の統合テスト
 * 何を: 付与の冪等な追加/削除と、スコープ集合での検索を検証する
 */
package org.openreg.registrar.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openreg.registrar.AbstractPostgresContainerTest;
import org.openreg.registrar.model.AccessGrantRecord;
import org.openreg.registrar.model.ScopeRef;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcAccessGrantRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private AccessGrantRepository accessGrantRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM access_grants", new MapSqlParameterSource());
  }

  @Test
  void insertIfAbsentIsIdempotent() {
    assertThat(
            accessGrantRepository.insertIfAbsent(
                "alice", "program_read_enrollments", ScopeRef.program(7), BASE_TIME))
        .isTrue();
    assertThat(
            accessGrantRepository.insertIfAbsent(
                "alice", "program_read_enrollments", ScopeRef.program(7), BASE_TIME.plusSeconds(5)))
        .isFalse();

    final List<AccessGrantRecord> grants = accessGrantRepository.findBySubject("alice");
    assertThat(grants).hasSize(1);
    assertThat(grants.get(0).grantedAt()).isEqualTo(BASE_TIME);
  }

  @Test
  void sameRoleOnDifferentScopeKindsAreDistinctGrants() {
    accessGrantRepository.insertIfAbsent(
        "alice", "program_read_metadata", ScopeRef.program(1), BASE_TIME);
    accessGrantRepository.insertIfAbsent(
        "alice", "program_read_metadata", ScopeRef.organization(1), BASE_TIME);

    assertThat(accessGrantRepository.findBySubject("alice"))
        .extracting(AccessGrantRecord::scope)
        .containsExactlyInAnyOrder(ScopeRef.program(1), ScopeRef.organization(1));
  }

  @Test
  void deleteReportsWhetherGrantExisted() {
    accessGrantRepository.insertIfAbsent(
        "alice", "organization_read_reports", ScopeRef.organization(3), BASE_TIME);

    assertThat(
            accessGrantRepository.delete("alice", "organization_read_reports", ScopeRef.organization(3)))
        .isTrue();
    assertThat(
            accessGrantRepository.delete("alice", "organization_read_reports", ScopeRef.organization(3)))
        .isFalse();
    assertThat(accessGrantRepository.findBySubject("alice")).isEmpty();
  }

  @Test
  void findBySubjectAndScopesMatchesKindAndId() {
    accessGrantRepository.insertIfAbsent(
        "alice", "organization_read_enrollments", ScopeRef.organization(1), BASE_TIME);
    accessGrantRepository.insertIfAbsent(
        "alice", "program_read_reports", ScopeRef.program(2), BASE_TIME);
    accessGrantRepository.insertIfAbsent(
        "alice", "program_read_reports", ScopeRef.program(1), BASE_TIME);
    accessGrantRepository.insertIfAbsent(
        "bob", "program_read_reports", ScopeRef.program(2), BASE_TIME);

    final List<AccessGrantRecord> grants =
        accessGrantRepository.findBySubjectAndScopes(
            "alice", List.of(ScopeRef.program(2), ScopeRef.organization(1)));

    assertThat(grants)
        .extracting(AccessGrantRecord::roleName)
        .containsExactlyInAnyOrder("organization_read_enrollments", "program_read_reports");
    assertThat(grants).extracting(AccessGrantRecord::scope).doesNotContain(ScopeRef.program(1));
  }

  @Test
  void findBySubjectAndScopesWithNoScopesReturnsEmpty() {
    accessGrantRepository.insertIfAbsent(
        "alice", "program_read_reports", ScopeRef.program(2), BASE_TIME);

    assertThat(accessGrantRepository.findBySubjectAndScopes("alice", List.of())).isEmpty();
  }
}
