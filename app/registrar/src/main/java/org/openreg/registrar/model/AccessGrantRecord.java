package org.openreg.registrar.model;

import java.time.Instant;

public record AccessGrantRecord(
    String subjectId, String roleName, ScopeRef scope, Instant grantedAt) {}
