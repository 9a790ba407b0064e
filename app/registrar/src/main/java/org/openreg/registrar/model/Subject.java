/*
 * どこで: Registrar モデル
 * 何を: 認証済み呼び出し元を表す
 * なぜ: 認証基盤から受け取った識別子をそのまま扱うため
 */
package org.openreg.registrar.model;

public record Subject(String subjectId, String username, String email, boolean administrator) {

  public Subject {
    if (subjectId == null || subjectId.isBlank()) {
      throw new IllegalArgumentException("subjectId is required");
    }
  }
}
