/*
 * どこで: Registrar モデル
 * 何を: プログラムと著作組織の関係を表す
 * なぜ: 組織スコープの権限をプログラムへ継承させるため
 */
package org.openreg.registrar.model;

import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

public record Program(
    long id,
    String key,
    UUID uuid,
    String title,
    ProgramType programType,
    long managingOrganizationId,
    Set<Long> authoringOrganizationIds) {

  public Program {
    if (programType == null) {
      throw new IllegalArgumentException("programType is required");
    }
    // 管理組織は常に著作組織に含まれる
    final Set<Long> authors =
        authoringOrganizationIds == null ? new TreeSet<>() : new TreeSet<>(authoringOrganizationIds);
    authors.add(managingOrganizationId);
    authoringOrganizationIds = Set.copyOf(authors);
  }

  public boolean isEnrollmentEnabled() {
    return programType.isEnrollmentEnabled();
  }
}
