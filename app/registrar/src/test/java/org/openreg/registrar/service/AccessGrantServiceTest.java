/*
 * どこで: AccessGrantService の単体テスト
 * 何を: 付与時のロール検証と冪等な付与/剥奪を検証する
 * なぜ: 未定義ロールを解決時ではなく付与時に拒否することを保証するため
 */
package org.openreg.registrar.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openreg.registrar.api.InvalidRoleException;
import org.openreg.registrar.api.ScopeNotFoundException;
import org.openreg.registrar.model.AccessGrantRecord;
import org.openreg.registrar.model.Organization;
import org.openreg.registrar.model.ProgramType;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.support.InMemoryAccessGrantRepository;
import org.openreg.registrar.support.InMemoryEntityGraphRepository;

class AccessGrantServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  private InMemoryEntityGraphRepository graph;
  private InMemoryAccessGrantRepository grants;
  private AccessGrantService service;
  private Organization acme;

  @BeforeEach
  void setUp() {
    graph = new InMemoryEntityGraphRepository();
    grants = new InMemoryAccessGrantRepository();
    service =
        new AccessGrantService(
            grants, graph, new RoleCatalog(), Clock.fixed(NOW, ZoneOffset.UTC));
    acme = graph.organization("acme");
  }

  @Test
  void grantIsIdempotent() {
    final ScopeRef scope = ScopeRef.organization(acme.id());

    assertThat(service.grant("u1", "program_manager", scope)).isTrue();
    assertThat(service.grant("u1", "program_manager", scope)).isFalse();

    assertThat(service.listBySubject("u1"))
        .containsExactly(new AccessGrantRecord("u1", "program_manager", scope, NOW));
  }

  @Test
  void undefinedRoleIsRejectedAtGrantTime() {
    assertThatThrownBy(() -> service.grant("u1", "superuser", ScopeRef.organization(acme.id())))
        .isInstanceOfSatisfying(
            InvalidRoleException.class,
            ex -> {
              assertThat(ex.storedGrant()).isFalse();
              assertThat(ex.roleName()).isEqualTo("superuser");
            });
    assertThat(service.listBySubject("u1")).isEmpty();
  }

  @Test
  void roleMustMatchScopeKind() {
    final long programId = graph.program("acme-mba", ProgramType.MASTERS, acme).id();

    assertThatThrownBy(() -> service.grant("u1", "program_manager", ScopeRef.program(programId)))
        .isInstanceOf(InvalidRoleException.class)
        .hasMessageContaining("organization only");
  }

  @Test
  void missingScopeIsNotFound() {
    assertThatThrownBy(
            () -> service.grant("u1", "organization_read_metadata", ScopeRef.organization(404L)))
        .isInstanceOf(ScopeNotFoundException.class);
  }

  @Test
  void revokeRemovesOnlyMatchingGrant() {
    final ScopeRef scope = ScopeRef.organization(acme.id());
    service.grant("u1", "program_manager", scope);
    service.grant("u1", "organization_read_reports", scope);

    assertThat(service.revoke("u1", "program_manager", scope)).isTrue();
    assertThat(service.revoke("u1", "program_manager", scope)).isFalse();
    assertThat(service.listBySubject("u1"))
        .extracting(AccessGrantRecord::roleName)
        .containsExactly("organization_read_reports");
  }

  @Test
  void blankSubjectIsRejected() {
    assertThatThrownBy(() -> service.listBySubject(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
