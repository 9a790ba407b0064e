/*
 * どこで: Registrar データアクセス
 * 何を: エンティティグラフを PostgreSQL で参照/更新する
 * なぜ: 著作関係の追加を即座に認可解決へ反映するため (キャッシュしない)
 */
package org.openreg.registrar.repository;

import static org.openreg.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.model.Organization;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.ProgramType;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcEntityGraphRepository implements EntityGraphRepository {

  private static final String ORGANIZATION_COLUMNS =
      "organization_id, organization_key, organization_uuid, name";
  private static final String PROGRAM_COLUMNS =
      "p.program_id, p.program_key, p.program_uuid, p.title, p.program_type,"
          + " p.managing_organization_id";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public Optional<Organization> findOrganizationById(long organizationId) {
    final String sql =
        "SELECT " + ORGANIZATION_COLUMNS + " FROM organizations WHERE organization_id = :id";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("id", organizationId), this::mapOrganization)
        .stream()
        .findFirst();
  }

  @Override
  public Optional<Organization> findOrganizationByKey(String organizationKey) {
    final String sql =
        "SELECT " + ORGANIZATION_COLUMNS + " FROM organizations WHERE organization_key = :key";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("key", organizationKey), this::mapOrganization)
        .stream()
        .findFirst();
  }

  @Override
  public List<Organization> findOrganizationsByIds(Collection<Long> organizationIds) {
    if (organizationIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        "SELECT "
            + ORGANIZATION_COLUMNS
            + " FROM organizations WHERE organization_id IN (:ids) ORDER BY organization_id";
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("ids", organizationIds), this::mapOrganization);
  }

  @Override
  public Optional<Program> findProgramById(long programId) {
    return findPrograms("p.program_id = :id", new MapSqlParameterSource("id", programId))
        .stream()
        .findFirst();
  }

  @Override
  public Optional<Program> findProgramByKey(String programKey) {
    return findPrograms("p.program_key = :key", new MapSqlParameterSource("key", programKey))
        .stream()
        .findFirst();
  }

  @Override
  public List<Program> findProgramsByIds(Collection<Long> programIds) {
    if (programIds.isEmpty()) {
      return List.of();
    }
    return findPrograms("p.program_id IN (:ids)", new MapSqlParameterSource("ids", programIds));
  }

  @Override
  public List<Program> findProgramsAuthoredBy(Collection<Long> organizationIds) {
    if (organizationIds.isEmpty()) {
      return List.of();
    }
    final String where =
        """
        p.program_id IN (
          SELECT program_id FROM program_authoring_organizations
          WHERE organization_id IN (:ids)
        )
        """;
    return findPrograms(where, new MapSqlParameterSource("ids", organizationIds));
  }

  @Override
  public Organization insertOrganization(String key, UUID uuid, String name, Instant createdAt) {
    final String sql =
        """
        INSERT INTO organizations (organization_key, organization_uuid, name, created_at)
        VALUES (:key, :uuid, :name, :createdAt)
        RETURNING organization_id, organization_key, organization_uuid, name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("uuid", uuid)
            .addValue("name", name)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapOrganization);
  }

  @Override
  public Program insertProgram(
      String key,
      UUID uuid,
      String title,
      ProgramType programType,
      long managingOrganizationId,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO programs (
          program_key, program_uuid, title, program_type, managing_organization_id, created_at
        ) VALUES (
          :key, :uuid, :title, :programType, :managingOrganizationId, :createdAt
        )
        RETURNING program_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("key", key)
            .addValue("uuid", uuid)
            .addValue("title", title)
            .addValue("programType", programType.name())
            .addValue("managingOrganizationId", managingOrganizationId)
            .addValue("createdAt", toTimestamp(createdAt));
    final Long programId = jdbcTemplate.queryForObject(sql, params, Long.class);
    addAuthoringOrganization(programId, managingOrganizationId);
    return new Program(
        programId, key, uuid, title, programType, managingOrganizationId, Set.of());
  }

  @Override
  public boolean addAuthoringOrganization(long programId, long organizationId) {
    final String sql =
        """
        INSERT INTO program_authoring_organizations (program_id, organization_id)
        VALUES (:programId, :organizationId)
        ON CONFLICT DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("programId", programId)
            .addValue("organizationId", organizationId);
    return jdbcTemplate.update(sql, params) > 0;
  }

  private List<Program> findPrograms(String where, MapSqlParameterSource params) {
    final String sql =
        "SELECT " + PROGRAM_COLUMNS + " FROM programs p WHERE " + where + " ORDER BY p.program_id";
    final List<ProgramRow> rows = jdbcTemplate.query(sql, params, this::mapProgramRow);
    if (rows.isEmpty()) {
      return List.of();
    }
    final Map<Long, Set<Long>> authors = loadAuthors(rows);
    final List<Program> programs = new ArrayList<>(rows.size());
    for (ProgramRow row : rows) {
      programs.add(
          new Program(
              row.programId(),
              row.key(),
              row.uuid(),
              row.title(),
              row.programType(),
              row.managingOrganizationId(),
              authors.getOrDefault(row.programId(), Set.of())));
    }
    return programs;
  }

  private Map<Long, Set<Long>> loadAuthors(List<ProgramRow> rows) {
    final List<Long> programIds = rows.stream().map(ProgramRow::programId).toList();
    final String sql =
        """
        SELECT program_id, organization_id
        FROM program_authoring_organizations
        WHERE program_id IN (:ids)
        """;
    final Map<Long, Set<Long>> authors = new HashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("ids", programIds),
        rs -> {
          authors
              .computeIfAbsent(rs.getLong("program_id"), ignored -> new HashSet<>())
              .add(rs.getLong("organization_id"));
        });
    return authors;
  }

  private Organization mapOrganization(ResultSet rs, int rowNum) throws SQLException {
    return new Organization(
        rs.getLong("organization_id"),
        rs.getString("organization_key"),
        rs.getObject("organization_uuid", UUID.class),
        rs.getString("name"));
  }

  private ProgramRow mapProgramRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProgramRow(
        rs.getLong("program_id"),
        rs.getString("program_key"),
        rs.getObject("program_uuid", UUID.class),
        rs.getString("title"),
        ProgramType.valueOf(rs.getString("program_type")),
        rs.getLong("managing_organization_id"));
  }

  private record ProgramRow(
      long programId,
      String key,
      UUID uuid,
      String title,
      ProgramType programType,
      long managingOrganizationId) {}
}
