/*
 * どこで: Registrar モデル
 * 何を: 権限付与先スコープ (組織 or プログラム) を表す
 * なぜ: 付与とジョブ対象を同じ参照型で扱うため
 */
package org.openreg.registrar.model;

public record ScopeRef(ScopeKind kind, long id) {

  public ScopeRef {
    if (kind == null) {
      throw new IllegalArgumentException("scope kind is required");
    }
  }

  public static ScopeRef organization(long id) {
    return new ScopeRef(ScopeKind.ORGANIZATION, id);
  }

  public static ScopeRef program(long id) {
    return new ScopeRef(ScopeKind.PROGRAM, id);
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase() + ":" + id;
  }
}
