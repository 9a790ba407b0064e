/*
 * どこで: Registrar テスト支援
 * 何を: EntityGraphRepository のメモリ実装
 * なぜ: 認可判定とジョブ実行の単体テストを DB なしで回すため
 */
package org.openreg.registrar.support;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.openreg.registrar.model.Organization;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.ProgramType;
import org.openreg.registrar.model.ScopeKind;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.repository.EntityGraphRepository;

public class InMemoryEntityGraphRepository implements EntityGraphRepository {

  private final AtomicLong sequence = new AtomicLong();
  private final Map<Long, Organization> organizations = new LinkedHashMap<>();
  private final Map<Long, Program> programs = new LinkedHashMap<>();

  public Organization organization(String key) {
    return insertOrganization(key, UUID.randomUUID(), key.toUpperCase(), Instant.EPOCH);
  }

  public Program program(String key, ProgramType type, Organization managing, Organization... others) {
    final Program program =
        insertProgram(key, UUID.randomUUID(), key, type, managing.id(), Instant.EPOCH);
    for (Organization other : others) {
      addAuthoringOrganization(program.id(), other.id());
    }
    return programs.get(program.id());
  }

  public List<ScopeRef> allScopes(ScopeKind kind) {
    if (kind == ScopeKind.ORGANIZATION) {
      return organizations.keySet().stream().map(ScopeRef::organization).toList();
    }
    return programs.keySet().stream().map(ScopeRef::program).toList();
  }

  @Override
  public Optional<Organization> findOrganizationById(long organizationId) {
    return Optional.ofNullable(organizations.get(organizationId));
  }

  @Override
  public Optional<Organization> findOrganizationByKey(String organizationKey) {
    return organizations.values().stream().filter(o -> o.key().equals(organizationKey)).findFirst();
  }

  @Override
  public List<Organization> findOrganizationsByIds(Collection<Long> organizationIds) {
    return organizations.values().stream().filter(o -> organizationIds.contains(o.id())).toList();
  }

  @Override
  public Optional<Program> findProgramById(long programId) {
    return Optional.ofNullable(programs.get(programId));
  }

  @Override
  public Optional<Program> findProgramByKey(String programKey) {
    return programs.values().stream().filter(p -> p.key().equals(programKey)).findFirst();
  }

  @Override
  public List<Program> findProgramsByIds(Collection<Long> programIds) {
    return programs.values().stream().filter(p -> programIds.contains(p.id())).toList();
  }

  @Override
  public List<Program> findProgramsAuthoredBy(Collection<Long> organizationIds) {
    final List<Program> result = new ArrayList<>();
    for (Program program : programs.values()) {
      if (program.authoringOrganizationIds().stream().anyMatch(organizationIds::contains)) {
        result.add(program);
      }
    }
    return result;
  }

  @Override
  public Organization insertOrganization(String key, UUID uuid, String name, Instant createdAt) {
    final Organization organization = new Organization(sequence.incrementAndGet(), key, uuid, name);
    organizations.put(organization.id(), organization);
    return organization;
  }

  @Override
  public Program insertProgram(
      String key,
      UUID uuid,
      String title,
      ProgramType programType,
      long managingOrganizationId,
      Instant createdAt) {
    final Program program =
        new Program(
            sequence.incrementAndGet(),
            key,
            uuid,
            title,
            programType,
            managingOrganizationId,
            Set.of(managingOrganizationId));
    programs.put(program.id(), program);
    return program;
  }

  @Override
  public boolean addAuthoringOrganization(long programId, long organizationId) {
    final Program program = programs.get(programId);
    if (program.authoringOrganizationIds().contains(organizationId)) {
      return false;
    }
    final Set<Long> authors = new LinkedHashSet<>(program.authoringOrganizationIds());
    authors.add(organizationId);
    programs.put(
        programId,
        new Program(
            program.id(),
            program.key(),
            program.uuid(),
            program.title(),
            program.programType(),
            program.managingOrganizationId(),
            authors));
    return true;
  }
}
