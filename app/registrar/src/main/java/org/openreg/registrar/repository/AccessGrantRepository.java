/*
 * どこで: Registrar データアクセス
 * 何を: (subject, role, scope) 付与の永続化を抽象化する
 * なぜ: 認可解決を永続化方式から切り離してテスト可能にするため
 */
package org.openreg.registrar.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.openreg.registrar.model.AccessGrantRecord;
import org.openreg.registrar.model.ScopeRef;

public interface AccessGrantRepository {

  /**
   * 役割: 付与を 1 件登録する。
   * 動作: 同一 (subject, role, scope) が既にあれば何もしない。
   * 戻り値: 新規に登録された場合 true。
   */
  boolean insertIfAbsent(String subjectId, String roleName, ScopeRef scope, Instant grantedAt);

  boolean delete(String subjectId, String roleName, ScopeRef scope);

  List<AccessGrantRecord> findBySubject(String subjectId);

  List<AccessGrantRecord> findBySubjectAndScopes(String subjectId, Collection<ScopeRef> scopes);
}
