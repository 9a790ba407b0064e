package org.openreg.registrar.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import org.openreg.registrar.model.AccessGrantRecord;
import org.openreg.registrar.model.ScopeKind;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GrantResponse(
    String subjectId, String role, ScopeKind scopeKind, long scopeId, Instant grantedAt) {

  static GrantResponse from(AccessGrantRecord grant) {
    return new GrantResponse(
        grant.subjectId(),
        grant.roleName(),
        grant.scope().kind(),
        grant.scope().id(),
        grant.grantedAt());
  }
}
