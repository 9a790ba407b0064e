package org.openreg.registrar.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import org.openreg.registrar.model.ApiPermission;
import org.openreg.registrar.model.ScopeKind;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuthorizedScopesResponse(
    ApiPermission action, ScopeKind scopeKind, List<Long> scopeIds) {}
