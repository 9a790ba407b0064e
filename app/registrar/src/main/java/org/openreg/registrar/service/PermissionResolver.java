/*
 * どこで: Registrar 認可
 * 何を: subject と対象スコープから内部権限の和集合を求め、API 権限へ畳み込む
 * なぜ: 組織で付与した権限を著作プログラムへ加算的に継承させるため
 */
package org.openreg.registrar.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.api.InvalidRoleException;
import org.openreg.registrar.api.ScopeNotFoundException;
import org.openreg.registrar.model.AccessGrantRecord;
import org.openreg.registrar.model.ApiPermission;
import org.openreg.registrar.model.AuthorizationDecision;
import org.openreg.registrar.model.InternalPermission;
import org.openreg.registrar.model.Organization;
import org.openreg.registrar.model.Program;
import org.openreg.registrar.model.RoleDefinition;
import org.openreg.registrar.model.ScopeKind;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.repository.AccessGrantRepository;
import org.openreg.registrar.repository.EntityGraphRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PermissionResolver {

  private static final Logger logger = LoggerFactory.getLogger(PermissionResolver.class);

  private final EntityGraphRepository entityGraphRepository;
  private final AccessGrantRepository accessGrantRepository;
  private final RoleCatalog roleCatalog;
  private final RegistrarMetrics metrics;

  public AuthorizationDecision resolve(String subjectId, ScopeRef target, ApiPermission action) {
    final Target resolved = loadTarget(target);
    final Set<ApiPermission> permissions =
        roleCatalog.toApiPermissions(collect(subjectId, resolved.applicableScopes()));
    if (resolved.program() != null && !resolved.program().isEnrollmentEnabled()) {
      // 学位プログラム以外では登録系 API を提供しない
      permissions.removeIf(ApiPermission::isEnrollmentPermission);
    }
    final boolean granted = permissions.contains(action);
    metrics.recordAuthorization(action.value(), granted);
    logger.debug(
        "authorization resolved subjectId={} target={} action={} granted={}",
        subjectId,
        target,
        action.value(),
        granted);
    return new AuthorizationDecision(granted, permissions);
  }

  /** API 権限へ畳み込む前の内部権限。ジョブ参照権限など内部専用の判定に使う。 */
  public Set<InternalPermission> resolveInternal(String subjectId, ScopeRef target) {
    return collect(subjectId, loadTarget(target).applicableScopes());
  }

  /**
   * 役割: action が許可されるスコープを列挙する。
   * 動作: subject の付与を起点に、組織付与は著作プログラムへ下方向に展開する。
   *       エンティティ総数ではなく付与件数に比例する。
   */
  public Set<ScopeRef> listAuthorizedScopes(
      String subjectId, ApiPermission action, ScopeKind scopeKind) {
    final Set<InternalPermission> conferring = roleCatalog.internalPermissionsFor(action);
    final Set<Long> organizationIds = new HashSet<>();
    final Set<Long> programIds = new HashSet<>();
    for (AccessGrantRecord grant : accessGrantRepository.findBySubject(subjectId)) {
      if (!confers(expand(grant), conferring)) {
        continue;
      }
      if (grant.scope().kind() == ScopeKind.ORGANIZATION) {
        organizationIds.add(grant.scope().id());
      } else {
        programIds.add(grant.scope().id());
      }
    }
    final Set<ScopeRef> result = new LinkedHashSet<>();
    if (scopeKind == ScopeKind.ORGANIZATION) {
      for (Organization organization : entityGraphRepository.findOrganizationsByIds(organizationIds)) {
        result.add(ScopeRef.organization(organization.id()));
      }
      return result;
    }
    final List<Program> candidates = new ArrayList<>();
    candidates.addAll(entityGraphRepository.findProgramsAuthoredBy(organizationIds));
    candidates.addAll(entityGraphRepository.findProgramsByIds(programIds));
    for (Program program : candidates) {
      if (action.isEnrollmentPermission() && !program.isEnrollmentEnabled()) {
        continue;
      }
      result.add(ScopeRef.program(program.id()));
    }
    return result;
  }

  private Target loadTarget(ScopeRef target) {
    if (target.kind() == ScopeKind.ORGANIZATION) {
      entityGraphRepository
          .findOrganizationById(target.id())
          .orElseThrow(() -> new ScopeNotFoundException("organization not found: " + target.id()));
      return new Target(null, List.of(target));
    }
    final Program program =
        entityGraphRepository
            .findProgramById(target.id())
            .orElseThrow(() -> new ScopeNotFoundException("program not found: " + target.id()));
    final List<ScopeRef> scopes = new ArrayList<>();
    scopes.add(target);
    for (Long organizationId : program.authoringOrganizationIds()) {
      scopes.add(ScopeRef.organization(organizationId));
    }
    return new Target(program, scopes);
  }

  private Set<InternalPermission> collect(String subjectId, Collection<ScopeRef> scopes) {
    final Set<InternalPermission> permissions = EnumSet.noneOf(InternalPermission.class);
    for (AccessGrantRecord grant : accessGrantRepository.findBySubjectAndScopes(subjectId, scopes)) {
      permissions.addAll(expand(grant));
    }
    return permissions;
  }

  private Set<InternalPermission> expand(AccessGrantRecord grant) {
    final RoleDefinition role = roleCatalog.find(grant.roleName()).orElse(null);
    if (role == null) {
      final InvalidRoleException ex =
          InvalidRoleException.storedGrant(grant.roleName(), grant.subjectId());
      logger.error(
          "stored grant references undefined role subjectId={} role={} scope={}",
          grant.subjectId(),
          grant.roleName(),
          grant.scope(),
          ex);
      throw ex;
    }
    return role.permissions();
  }

  private boolean confers(Set<InternalPermission> granted, Set<InternalPermission> conferring) {
    for (InternalPermission permission : granted) {
      if (conferring.contains(permission)) {
        return true;
      }
    }
    return false;
  }

  private record Target(Program program, List<ScopeRef> applicableScopes) {}
}
