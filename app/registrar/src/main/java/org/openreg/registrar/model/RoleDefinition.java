package org.openreg.registrar.model;

import java.util.Set;

public record RoleDefinition(
    String name, String description, ScopeKind scopeKind, Set<InternalPermission> permissions) {

  public RoleDefinition {
    permissions = Set.copyOf(permissions);
  }
}
