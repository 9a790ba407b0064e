/*
 * どこで: Registrar モデル
 * 何を: 付与経路 (組織/プログラム) を区別する内部権限を定義する
 * なぜ: 監査時にどのスコープ経由で許可されたかを追えるようにするため
 */
package org.openreg.registrar.model;

public enum InternalPermission {
  ORGANIZATION_READ_METADATA(ScopeKind.ORGANIZATION),
  ORGANIZATION_READ_ENROLLMENTS(ScopeKind.ORGANIZATION),
  ORGANIZATION_WRITE_ENROLLMENTS(ScopeKind.ORGANIZATION),
  ORGANIZATION_READ_REPORTS(ScopeKind.ORGANIZATION),
  ORGANIZATION_READ_JOBS(ScopeKind.ORGANIZATION),
  PROGRAM_READ_METADATA(ScopeKind.PROGRAM),
  PROGRAM_READ_ENROLLMENTS(ScopeKind.PROGRAM),
  PROGRAM_WRITE_ENROLLMENTS(ScopeKind.PROGRAM),
  PROGRAM_READ_REPORTS(ScopeKind.PROGRAM),
  PROGRAM_READ_JOBS(ScopeKind.PROGRAM);

  private final ScopeKind scopeKind;

  InternalPermission(ScopeKind scopeKind) {
    this.scopeKind = scopeKind;
  }

  public ScopeKind scopeKind() {
    return scopeKind;
  }

  public boolean isJobVisibility() {
    return this == ORGANIZATION_READ_JOBS || this == PROGRAM_READ_JOBS;
  }
}
