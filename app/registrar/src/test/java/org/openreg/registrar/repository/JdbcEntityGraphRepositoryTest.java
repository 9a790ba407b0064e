/*
 * どこで: JdbcEntityGraphRepository の統合テスト
 * 何を: 組織/プログラムの登録と、著作関係をたどる検索を検証する
 * なぜ: 権限解決が祖先スコープと逆方向の列挙の両方をこの検索に依存するため
 */
package org.openreg.registrar.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openreg.registrar.AbstractPostgresContainerTest;
import org.openreg.registrar.model.Organization;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.ProgramType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcEntityGraphRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private EntityGraphRepository entityGraphRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM program_authoring_organizations", none);
    jdbcTemplate.update("DELETE FROM programs", none);
    jdbcTemplate.update("DELETE FROM organizations", none);
  }

  @Test
  void insertProgramMakesManagingOrganizationAnAuthor() {
    final Organization mitx = organization("mitx");

    final Program program =
        entityGraphRepository.insertProgram(
            "data-masters", UUID.randomUUID(), "Data Masters", ProgramType.MASTERS, mitx.id(), BASE_TIME);

    final Program loaded = entityGraphRepository.findProgramById(program.id()).orElseThrow();
    assertThat(loaded.key()).isEqualTo("data-masters");
    assertThat(loaded.programType()).isEqualTo(ProgramType.MASTERS);
    assertThat(loaded.managingOrganizationId()).isEqualTo(mitx.id());
    assertThat(loaded.authoringOrganizationIds()).containsExactly(mitx.id());
    assertThat(entityGraphRepository.findProgramByKey("data-masters")).contains(loaded);
  }

  @Test
  void addAuthoringOrganizationIsIdempotent() {
    final Organization mitx = organization("mitx");
    final Organization harvardx = organization("harvardx");
    final Program program = program("joint", ProgramType.MICROMASTERS, mitx);

    assertThat(entityGraphRepository.addAuthoringOrganization(program.id(), harvardx.id())).isTrue();
    assertThat(entityGraphRepository.addAuthoringOrganization(program.id(), harvardx.id()))
        .isFalse();

    assertThat(entityGraphRepository.findProgramById(program.id()).orElseThrow().authoringOrganizationIds())
        .containsExactlyInAnyOrder(mitx.id(), harvardx.id());
  }

  @Test
  void findProgramsAuthoredByFollowsAuthoringEdges() {
    final Organization mitx = organization("mitx");
    final Organization harvardx = organization("harvardx");
    final Organization other = organization("other");
    final Program own = program("own", ProgramType.MASTERS, mitx);
    final Program joint = program("joint", ProgramType.MASTERS, harvardx);
    program("unrelated", ProgramType.MASTERS, other);
    entityGraphRepository.addAuthoringOrganization(joint.id(), mitx.id());

    final List<Program> programs = entityGraphRepository.findProgramsAuthoredBy(List.of(mitx.id()));

    assertThat(programs).extracting(Program::key).containsExactly("own", "joint");
    assertThat(programs.get(0).id()).isEqualTo(own.id());
    assertThat(entityGraphRepository.findProgramsAuthoredBy(List.of())).isEmpty();
  }

  @Test
  void findByIdsReturnsOnlyExistingRows() {
    final Organization mitx = organization("mitx");
    final Program program = program("p1", ProgramType.OTHER, mitx);

    assertThat(entityGraphRepository.findOrganizationsByIds(List.of(mitx.id(), -5L)))
        .extracting(Organization::key)
        .containsExactly("mitx");
    assertThat(entityGraphRepository.findProgramsByIds(List.of(program.id(), -5L)))
        .extracting(Program::key)
        .containsExactly("p1");
    assertThat(entityGraphRepository.findOrganizationById(-5L)).isEmpty();
    assertThat(entityGraphRepository.findOrganizationByKey("mitx")).contains(mitx);
  }

  @Test
  void duplicateOrganizationKeyIsRejected() {
    organization("mitx");

    assertThatThrownBy(() -> organization("mitx")).isInstanceOf(DuplicateKeyException.class);
  }

  private Organization organization(String key) {
    return entityGraphRepository.insertOrganization(key, UUID.randomUUID(), key.toUpperCase(), BASE_TIME);
  }

  private Program program(String key, ProgramType type, Organization managing) {
    return entityGraphRepository.insertProgram(
        key, UUID.randomUUID(), key, type, managing.id(), BASE_TIME);
  }
}
