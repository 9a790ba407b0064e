package org.openreg.registrar.model;

import java.net.URI;
import java.time.Instant;
import java.util.UUID;

/** 参照者に応じてフィルタ済みのジョブ状態。resultRef は所有者/管理者にのみ入る。 */
public record JobView(
    UUID jobId,
    JobOperation operation,
    ScopeRef target,
    JobState state,
    String message,
    boolean cancelRequested,
    Instant createdAt,
    Instant updatedAt,
    ResultRef resultRef,
    URI downloadUrl) {}
