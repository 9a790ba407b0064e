package org.openreg.registrar.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.openreg.registrar.model.ScopeKind;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GrantRequest(
    @NotBlank(message = "subject_id is required") String subjectId,
    @NotBlank(message = "role is required") String role,
    @NotNull(message = "scope_kind is required") ScopeKind scopeKind,
    @NotNull(message = "scope_id is required") Long scopeId) {}
