package org.openreg.registrar.model;

import java.util.Set;

public record AuthorizationDecision(boolean granted, Set<ApiPermission> apiPermissions) {

  public AuthorizationDecision {
    apiPermissions = Set.copyOf(apiPermissions);
  }
}
