package org.openreg.registrar.support;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.openreg.registrar.model.AccessGrantRecord;
import org.openreg.registrar.model.ScopeRef;
import org.openreg.registrar.repository.AccessGrantRepository;

public class InMemoryAccessGrantRepository implements AccessGrantRepository {

  private final List<AccessGrantRecord> grants = new ArrayList<>();

  /** 付与時検証を通さずに行を入れる。保存済み不整合データの再現用。 */
  public void insertRaw(String subjectId, String roleName, ScopeRef scope) {
    grants.add(new AccessGrantRecord(subjectId, roleName, scope, Instant.EPOCH));
  }

  @Override
  public synchronized boolean insertIfAbsent(
      String subjectId, String roleName, ScopeRef scope, Instant grantedAt) {
    if (find(subjectId, roleName, scope) != null) {
      return false;
    }
    grants.add(new AccessGrantRecord(subjectId, roleName, scope, grantedAt));
    return true;
  }

  @Override
  public synchronized boolean delete(String subjectId, String roleName, ScopeRef scope) {
    return grants.remove(find(subjectId, roleName, scope));
  }

  @Override
  public synchronized List<AccessGrantRecord> findBySubject(String subjectId) {
    return grants.stream().filter(g -> g.subjectId().equals(subjectId)).toList();
  }

  @Override
  public synchronized List<AccessGrantRecord> findBySubjectAndScopes(
      String subjectId, Collection<ScopeRef> scopes) {
    return grants.stream()
        .filter(g -> g.subjectId().equals(subjectId) && scopes.contains(g.scope()))
        .toList();
  }

  private AccessGrantRecord find(String subjectId, String roleName, ScopeRef scope) {
    return grants.stream()
        .filter(
            g ->
                g.subjectId().equals(subjectId)
                    && g.roleName().equals(roleName)
                    && g.scope().equals(scope))
        .findFirst()
        .orElse(null);
  }
}
