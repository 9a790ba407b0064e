/*
 * どこで: Registrar ジョブモデル
 * 何を: ジョブの操作種別と必要な API 権限を定義する
 * なぜ: 投入時の認可判定を操作種別から一意に決めるため
 */
package org.openreg.registrar.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Set;

public enum JobOperation {
  READ_ENROLLMENTS(ApiPermission.READ_ENROLLMENTS, Set.of(ScopeKind.PROGRAM)),
  WRITE_ENROLLMENTS(ApiPermission.WRITE_ENROLLMENTS, Set.of(ScopeKind.PROGRAM)),
  GENERATE_REPORT(ApiPermission.READ_REPORTS, Set.of(ScopeKind.ORGANIZATION, ScopeKind.PROGRAM));

  private final ApiPermission requiredPermission;
  private final Set<ScopeKind> targetKinds;

  JobOperation(ApiPermission requiredPermission, Set<ScopeKind> targetKinds) {
    this.requiredPermission = requiredPermission;
    this.targetKinds = targetKinds;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static JobOperation fromValue(String value) {
    for (JobOperation operation : values()) {
      if (operation.name().equalsIgnoreCase(value)) {
        return operation;
      }
    }
    throw new IllegalArgumentException("unknown operation: " + value);
  }

  public ApiPermission requiredPermission() {
    return requiredPermission;
  }

  public boolean supports(ScopeKind kind) {
    return targetKinds.contains(kind);
  }
}
