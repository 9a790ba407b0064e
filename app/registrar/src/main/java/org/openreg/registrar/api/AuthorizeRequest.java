package org.openreg.registrar.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import org.openreg.registrar.model.ApiPermission;
import org.openreg.registrar.model.ScopeKind;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuthorizeRequest(
    @NotNull(message = "action is required") ApiPermission action,
    @NotNull(message = "scope_kind is required") ScopeKind scopeKind,
    @NotNull(message = "scope_id is required") Long scopeId) {}
