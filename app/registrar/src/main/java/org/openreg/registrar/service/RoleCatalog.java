/*
 * どこで: Registrar 認可
 * 何を: ロール→内部権限、内部権限→API 権限の静的テーブルを保持する
 * なぜ: 起動時に表の網羅性を検証し、解決時は参照のみで済ませるため
 */
package org.openreg.registrar.service;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.openreg.registrar.model.ApiPermission;
import org.openreg.registrar.model.InternalPermission;
import org.openreg.registrar.model.RoleDefinition;
import org.openreg.registrar.model.ScopeKind;
import org.springframework.stereotype.Component;

@Component
public class RoleCatalog {

  private static final Map<InternalPermission, ApiPermission> API_MAPPING = defaultApiMapping();
  private static final Set<InternalPermission> INTERNAL_ONLY =
      EnumSet.of(InternalPermission.ORGANIZATION_READ_JOBS, InternalPermission.PROGRAM_READ_JOBS);

  private final Map<String, RoleDefinition> roles;
  private final Map<InternalPermission, ApiPermission> apiMapping;

  public RoleCatalog() {
    this(defaultRoles(), API_MAPPING, INTERNAL_ONLY);
  }

  RoleCatalog(
      List<RoleDefinition> roles,
      Map<InternalPermission, ApiPermission> apiMapping,
      Set<InternalPermission> internalOnly) {
    verifyTotal(apiMapping, internalOnly);
    final Map<String, RoleDefinition> byName = new LinkedHashMap<>();
    for (RoleDefinition role : roles) {
      verifyRole(role, apiMapping, internalOnly);
      if (byName.putIfAbsent(role.name(), role) != null) {
        throw new IllegalStateException("duplicate role definition: " + role.name());
      }
    }
    this.roles = Collections.unmodifiableMap(byName);
    this.apiMapping = Collections.unmodifiableMap(new EnumMap<>(apiMapping));
  }

  public Optional<RoleDefinition> find(String roleName) {
    return Optional.ofNullable(roles.get(roleName));
  }

  public Collection<RoleDefinition> roles() {
    return roles.values();
  }

  /** 内部権限の集合を API 権限へ畳み込む。内部専用の権限は捨てる。 */
  public Set<ApiPermission> toApiPermissions(Collection<InternalPermission> permissions) {
    final Set<ApiPermission> result = EnumSet.noneOf(ApiPermission.class);
    for (InternalPermission permission : permissions) {
      final ApiPermission api = apiMapping.get(permission);
      if (api != null) {
        result.add(api);
      }
    }
    return result;
  }

  /** 指定 API 権限へ写像される内部権限の集合 (逆引き)。 */
  public Set<InternalPermission> internalPermissionsFor(ApiPermission apiPermission) {
    final Set<InternalPermission> result = EnumSet.noneOf(InternalPermission.class);
    apiMapping.forEach(
        (internal, api) -> {
          if (api == apiPermission) {
            result.add(internal);
          }
        });
    return result;
  }

  private static void verifyTotal(
      Map<InternalPermission, ApiPermission> apiMapping, Set<InternalPermission> internalOnly) {
    for (InternalPermission permission : InternalPermission.values()) {
      final boolean mapped = apiMapping.get(permission) != null;
      final boolean hidden = internalOnly.contains(permission);
      if (mapped == hidden) {
        // 公開先が一つ、または内部専用の明示のどちらか一方でなければならない
        throw new IllegalStateException(
            "internal permission must map to exactly one api permission or be internal-only: "
                + permission);
      }
    }
  }

  private static void verifyRole(
      RoleDefinition role,
      Map<InternalPermission, ApiPermission> apiMapping,
      Set<InternalPermission> internalOnly) {
    if (role.permissions().isEmpty()) {
      throw new IllegalStateException("role has no permissions: " + role.name());
    }
    for (InternalPermission permission : role.permissions()) {
      if (apiMapping.get(permission) == null && !internalOnly.contains(permission)) {
        throw new IllegalStateException(
            "role " + role.name() + " references unmapped permission " + permission);
      }
      if (permission.scopeKind() != role.scopeKind()) {
        throw new IllegalStateException(
            "role " + role.name() + " mixes scope kinds with permission " + permission);
      }
    }
  }

  private static Map<InternalPermission, ApiPermission> defaultApiMapping() {
    final Map<InternalPermission, ApiPermission> mapping = new EnumMap<>(InternalPermission.class);
    mapping.put(InternalPermission.ORGANIZATION_READ_METADATA, ApiPermission.READ_METADATA);
    mapping.put(InternalPermission.ORGANIZATION_READ_ENROLLMENTS, ApiPermission.READ_ENROLLMENTS);
    mapping.put(InternalPermission.ORGANIZATION_WRITE_ENROLLMENTS, ApiPermission.WRITE_ENROLLMENTS);
    mapping.put(InternalPermission.ORGANIZATION_READ_REPORTS, ApiPermission.READ_REPORTS);
    mapping.put(InternalPermission.PROGRAM_READ_METADATA, ApiPermission.READ_METADATA);
    mapping.put(InternalPermission.PROGRAM_READ_ENROLLMENTS, ApiPermission.READ_ENROLLMENTS);
    mapping.put(InternalPermission.PROGRAM_WRITE_ENROLLMENTS, ApiPermission.WRITE_ENROLLMENTS);
    mapping.put(InternalPermission.PROGRAM_READ_REPORTS, ApiPermission.READ_REPORTS);
    return mapping;
  }

  private static List<RoleDefinition> defaultRoles() {
    return List.of(
        new RoleDefinition(
            "organization_read_metadata",
            "View metadata of the organization and every program it authors",
            ScopeKind.ORGANIZATION,
            Set.of(InternalPermission.ORGANIZATION_READ_METADATA)),
        new RoleDefinition(
            "organization_read_enrollments",
            "Read enrollment data of the organization's programs",
            ScopeKind.ORGANIZATION,
            Set.of(
                InternalPermission.ORGANIZATION_READ_METADATA,
                InternalPermission.ORGANIZATION_READ_ENROLLMENTS)),
        new RoleDefinition(
            "organization_read_write_enrollments",
            "Read and write enrollment data of the organization's programs",
            ScopeKind.ORGANIZATION,
            Set.of(
                InternalPermission.ORGANIZATION_READ_METADATA,
                InternalPermission.ORGANIZATION_READ_ENROLLMENTS,
                InternalPermission.ORGANIZATION_WRITE_ENROLLMENTS)),
        new RoleDefinition(
            "organization_read_reports",
            "Read reports of the organization's programs",
            ScopeKind.ORGANIZATION,
            Set.of(
                InternalPermission.ORGANIZATION_READ_METADATA,
                InternalPermission.ORGANIZATION_READ_REPORTS)),
        new RoleDefinition(
            "program_manager",
            "Manage enrollments for every program the organization authors",
            ScopeKind.ORGANIZATION,
            Set.of(
                InternalPermission.ORGANIZATION_READ_METADATA,
                InternalPermission.ORGANIZATION_READ_ENROLLMENTS,
                InternalPermission.ORGANIZATION_WRITE_ENROLLMENTS)),
        new RoleDefinition(
            "organization_job_auditor",
            "See status of jobs submitted against the organization and its programs",
            ScopeKind.ORGANIZATION,
            Set.of(
                InternalPermission.ORGANIZATION_READ_METADATA,
                InternalPermission.ORGANIZATION_READ_JOBS)),
        new RoleDefinition(
            "program_read_metadata",
            "View metadata of a single program",
            ScopeKind.PROGRAM,
            Set.of(InternalPermission.PROGRAM_READ_METADATA)),
        new RoleDefinition(
            "program_read_enrollments",
            "Read enrollment data of a single program",
            ScopeKind.PROGRAM,
            Set.of(
                InternalPermission.PROGRAM_READ_METADATA,
                InternalPermission.PROGRAM_READ_ENROLLMENTS)),
        new RoleDefinition(
            "program_read_write_enrollments",
            "Read and write enrollment data of a single program",
            ScopeKind.PROGRAM,
            Set.of(
                InternalPermission.PROGRAM_READ_METADATA,
                InternalPermission.PROGRAM_READ_ENROLLMENTS,
                InternalPermission.PROGRAM_WRITE_ENROLLMENTS)),
        new RoleDefinition(
            "program_read_reports",
            "Read reports of a single program",
            ScopeKind.PROGRAM,
            Set.of(
                InternalPermission.PROGRAM_READ_METADATA,
                InternalPermission.PROGRAM_READ_REPORTS)),
        new RoleDefinition(
            "program_job_auditor",
            "See status of jobs submitted against a single program",
            ScopeKind.PROGRAM,
            Set.of(
                InternalPermission.PROGRAM_READ_METADATA,
                InternalPermission.PROGRAM_READ_JOBS)));
  }
}
