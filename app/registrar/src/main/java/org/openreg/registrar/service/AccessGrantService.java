/*
 * どこで: Registrar サービス層
 * 何を: ロール付与/剥奪/一覧の業務ルールを実装する
 * なぜ: 未定義ロールや存在しないスコープへの付与を作成時点で拒否するため
 */
package org.openreg.registrar.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.openreg.registrar.api.InvalidRoleException;
import org.openreg.registrar.api.ScopeNotFoundException;
import org.openreg.registrar.model.AccessGrantRecord;
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
public class AccessGrantService {

  private static final Logger logger = LoggerFactory.getLogger(AccessGrantService.class);

  private final AccessGrantRepository accessGrantRepository;
  private final EntityGraphRepository entityGraphRepository;
  private final RoleCatalog roleCatalog;
  private final Clock clock;

  /** 新規に付与された場合 true。同一付与が既にあれば false (冪等)。 */
  public boolean grant(String subjectId, String roleName, ScopeRef scope) {
    requireSubject(subjectId);
    final RoleDefinition role =
        roleCatalog
            .find(roleName)
            .orElseThrow(() -> InvalidRoleException.rejected(roleName, "role is not defined"));
    if (role.scopeKind() != scope.kind()) {
      throw InvalidRoleException.rejected(
          roleName, "role is grantable on " + role.scopeKind().name().toLowerCase() + " only");
    }
    requireScope(scope);
    final Instant now = Instant.now(clock);
    final boolean created = accessGrantRepository.insertIfAbsent(subjectId, roleName, scope, now);
    logger.info(
        "access grant subjectId={} role={} scope={} created={}", subjectId, roleName, scope, created);
    return created;
  }

  public boolean revoke(String subjectId, String roleName, ScopeRef scope) {
    requireSubject(subjectId);
    final boolean removed = accessGrantRepository.delete(subjectId, roleName, scope);
    logger.info(
        "access revoke subjectId={} role={} scope={} removed={}", subjectId, roleName, scope, removed);
    return removed;
  }

  public List<AccessGrantRecord> listBySubject(String subjectId) {
    requireSubject(subjectId);
    return accessGrantRepository.findBySubject(subjectId);
  }

  private void requireScope(ScopeRef scope) {
    final boolean exists =
        scope.kind() == ScopeKind.ORGANIZATION
            ? entityGraphRepository.findOrganizationById(scope.id()).isPresent()
            : entityGraphRepository.findProgramById(scope.id()).isPresent();
    if (!exists) {
      throw new ScopeNotFoundException(scope.kind().name().toLowerCase() + " not found: " + scope.id());
    }
  }

  private void requireSubject(String subjectId) {
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("subject_id is required");
    }
  }
}
