/*
 * どこで: Registrar API
 * 何を: 未定義ロール、またはスコープ種別に合わないロールを表現する
 * なぜ: 付与時の入力誤りと保存済みデータの不整合を区別して扱うため
 */
package org.openreg.registrar.api;

public class InvalidRoleException extends RuntimeException {

  private final String roleName;
  private final boolean storedGrant;

  private InvalidRoleException(String roleName, boolean storedGrant, String message) {
    super(message);
    this.roleName = roleName;
    this.storedGrant = storedGrant;
  }

  public static InvalidRoleException rejected(String roleName, String reason) {
    return new InvalidRoleException(roleName, false, "invalid role " + roleName + ": " + reason);
  }

  // 付与時検証をすり抜けた保存済みグラント。到達した場合はデータ不整合
  public static InvalidRoleException storedGrant(String roleName, String subjectId) {
    return new InvalidRoleException(
        roleName, true, "stored grant references undefined role " + roleName + " subject=" + subjectId);
  }

  public String roleName() {
    return roleName;
  }

  public boolean storedGrant() {
    return storedGrant;
  }
}
